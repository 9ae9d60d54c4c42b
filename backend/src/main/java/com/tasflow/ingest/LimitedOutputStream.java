package com.tasflow.ingest;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Output stream that refuses to grow past a fixed size. Guards decompression against zip bombs.
 */
public class LimitedOutputStream extends FilterOutputStream {

    private final long maxSize;
    private long totalBytesWritten;

    public LimitedOutputStream(OutputStream out, long maxSize) {
        super(out);
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Maximum size must be greater than zero.");
        }
        this.maxSize = maxSize;
    }

    @Override
    public void write(int b) throws IOException {
        checkSizeLimit(1);
        out.write(b);
        totalBytesWritten++;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        checkSizeLimit(len);
        out.write(b, off, len);
        totalBytesWritten += len;
    }

    private void checkSizeLimit(int bytesToWrite) {
        if (totalBytesWritten + bytesToWrite > maxSize) {
            throw new DecompressedSizeExceededException(maxSize, totalBytesWritten + bytesToWrite);
        }
    }
}
