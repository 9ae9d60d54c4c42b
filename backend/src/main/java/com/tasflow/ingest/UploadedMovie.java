package com.tasflow.ingest;

/**
 * Movie file as received from the client.
 *
 * @param fileName    original file name
 * @param contentType declared content type, may be null
 * @param content     raw bytes, possibly gzip compressed
 */
public record UploadedMovie(String fileName, String contentType, byte[] content) {
}
