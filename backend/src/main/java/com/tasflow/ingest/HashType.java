package com.tasflow.ingest;

public enum HashType {
    MD5,
    SHA1,
    SHA256,
    CRC32
}
