package com.pgmetrics.log.parser;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.regex.Matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgmetrics.log.prefix.PrefixPattern;

/**
 * Finds where to start reading a log file so that everything from a given
 * instant onwards is covered, without reading the whole file.
 *
 * <p>Blocks of {@value #BLOCK_SIZE} bytes are examined from the end of the
 * file backwards. The first block whose first timestamp is before the
 * window start gives the offset. Reaching offset 0 means the whole file is
 * needed.
 */
public class WindowLocator {

    private static final Logger logger = LoggerFactory.getLogger(WindowLocator.class);

    public static final int BLOCK_SIZE = 4096;

    /**
     * @param length the file length to work back from
     * @return offset of the first byte to read
     */
    public static long locate(RandomAccessFile file, long length, PrefixPattern prefix, Instant start)
            throws IOException {
        if (length <= 0) {
            return 0;
        }

        byte[] buf = new byte[BLOCK_SIZE];
        long ofs = length - BLOCK_SIZE;
        while (true) {
            if (ofs < 0) {
                ofs = 0;
            }
            file.seek(ofs);
            int n = (int) Math.min(BLOCK_SIZE, length - ofs);
            file.readFully(buf, 0, n);

            Instant ts = firstTimestamp(buf, n, ofs == 0, prefix);
            logger.trace("Block at {}: first timestamp {}", ofs, ts);
            if (ts != null && ts.isBefore(start)) {
                break;
            }
            if (ofs == 0) {
                break;
            }
            ofs -= BLOCK_SIZE;
        }

        logger.debug("Reading from offset {} of {} bytes", ofs, length);
        return ofs;
    }

    /**
     * Timestamp of the first prefix match in the block, or null if there is
     * none or it cannot be decoded. Unless the block starts the file, its
     * first line is partial and matching starts after the first newline.
     */
    static Instant firstTimestamp(byte[] buf, int length, boolean fileStart, PrefixPattern prefix) {
        String text = new String(buf, 0, length, StandardCharsets.UTF_8);
        int from = 0;
        if (!fileStart) {
            from = text.indexOf('\n') + 1;
            if (from == 0) {
                return null;
            }
        }
        Matcher m = prefix.matcher(text);
        if (!m.find(from)) {
            return null;
        }
        try {
            return TimestampDecoder.decode(m, prefix);
        } catch (TimestampDecodeException e) {
            logger.debug("Ignoring block timestamp: {}", e.getMessage());
            return null;
        }
    }
}
