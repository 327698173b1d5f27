// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.io;

import com.google.common.io.ByteStreams;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * <p>Some static io convenience methods.</p>
 */
public abstract class IOUtils {

    /** The suffix of gzip compressed files */
    public static final String GZIP_SUFFIX = ".gz";

    /** Returns whether the given file name denotes a gzip compressed file */
    public static boolean isGzipped(String fileName) {
        return fileName.endsWith(GZIP_SUFFIX);
    }

    /** Reads the given stream to the end. The stream is not closed. */
    public static byte[] readBytes(InputStream stream) throws IOException {
        return ByteStreams.toByteArray(stream);
    }

    /**
     * Reads the given stream to the end, decompressing it if gzipped is true, and closes it.
     */
    public static byte[] readBytes(InputStream stream, boolean gzipped) throws IOException {
        try (InputStream in = gzipped ? new GZIPInputStream(stream) : stream) {
            return readBytes(in);
        }
    }

    /** Reads a file, decompressing it if its name ends with {@link #GZIP_SUFFIX}. */
    public static byte[] readFile(Path file) throws IOException {
        return readBytes(Files.newInputStream(file), isGzipped(file.getFileName().toString()));
    }

    /** Reads all lines of a text file in the given encoding */
    public static List<String> readLines(Path file, Charset encoding) throws IOException {
        return Files.readAllLines(file, encoding);
    }

    /**
     * Writes the given bytes to a file, compressing them if the name ends with {@link #GZIP_SUFFIX}.
     * Directories leading up to the file are created if missing.
     */
    public static void writeFile(Path file, byte[] data) throws IOException {
        if (file.getParent() != null)
            Files.createDirectories(file.getParent());
        try (OutputStream out = createOutputStream(file)) {
            out.write(data);
        }
    }

    private static OutputStream createOutputStream(Path file) throws IOException {
        OutputStream out = new BufferedOutputStream(Files.newOutputStream(file));
        return isGzipped(file.getFileName().toString()) ? new GZIPOutputStream(out) : out;
    }

}
