/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Serializes HDUs into FITS blocks.
 */
final class FitsFileWriter {

    private FitsFileWriter() {
    }

    static void write(Path path, List<Hdu> hdus, OpenOption... options) throws IOException {
        try (FileChannel channel = FileChannel.open(path, options)) {
            for (int i = 0; i < hdus.size(); i++) {
                Hdu hdu = hdus.get(i);
                hdu.syncHeader(i == 0);
                writeFully(channel, ByteBuffer.wrap(headerBytes(hdu.header())));

                byte[] data = hdu.data();
                int padded = FitsFileReader.padded(data.length);
                writeFully(channel, ByteBuffer.wrap(data));
                if (padded > data.length) {
                    writeFully(channel, ByteBuffer.wrap(new byte[padded - data.length]));
                }
            }
        }
    }

    static byte[] headerBytes(Header header) {
        StringBuilder sb = new StringBuilder();
        for (HeaderCard card : header.cards()) {
            sb.append(card.format());
        }
        sb.append(HeaderCard.commentary("END", null).format());
        byte[] text = sb.toString().getBytes(StandardCharsets.ISO_8859_1);
        byte[] block = Arrays.copyOf(text, FitsFileReader.padded(text.length));
        Arrays.fill(block, text.length, block.length, (byte) ' ');
        return block;
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }
}
