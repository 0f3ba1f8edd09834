/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import dev.fitsio.engine.Status;

/**
 * Parses a whole FITS file: 2880-byte blocks, each header a run of 80-character
 * records up to END, each data unit padded to a block boundary.
 */
final class FitsFileReader {

    static final int BLOCK_SIZE = 2880;

    private static final System.Logger LOG = System.getLogger(FitsFileReader.class.getName());

    private FitsFileReader() {
    }

    static List<Hdu> read(ByteBuffer file) throws StatusException {
        List<Hdu> hdus = new ArrayList<>();
        int offset = 0;
        while (offset + BLOCK_SIZE <= file.limit()) {
            boolean primary = hdus.isEmpty();
            if (!primary && !startsWith(file, offset, "XTENSION")) {
                LOG.log(System.Logger.Level.DEBUG, "Ignoring {0} bytes after the last HDU", file.limit() - offset);
                break;
            }

            List<HeaderCard> cards = new ArrayList<>();
            offset = readHeader(file, offset, cards);
            Header header = new Header(cards);
            Hdu hdu = primary ? readPrimary(file, offset, header) : readExtension(file, offset, header);
            hdus.add(hdu);
            offset += padded(hdu.data().length);
        }
        if (hdus.isEmpty()) {
            throw new StatusException(file.limit() == 0 ? Status.END_OF_FILE : Status.NO_SIMPLE);
        }
        return hdus;
    }

    /**
     * Reads records until END, returning the offset of the first data block.
     */
    private static int readHeader(ByteBuffer file, int offset, List<HeaderCard> cards) throws StatusException {
        byte[] record = new byte[HeaderCard.LENGTH];
        int position = offset;
        while (true) {
            if (position + HeaderCard.LENGTH > file.limit()) {
                throw new StatusException(Status.NO_END);
            }
            file.get(position, record);
            position += HeaderCard.LENGTH;
            String text = new String(record, StandardCharsets.ISO_8859_1);
            if (text.startsWith("END") && text.substring(3).isBlank()) {
                break;
            }
            if (!text.isBlank()) {
                cards.add(HeaderCard.parse(text));
            }
        }
        return offset + padded(position - offset);
    }

    private static Hdu readPrimary(ByteBuffer file, int offset, Header header) throws StatusException {
        if (header.cards().isEmpty() || !header.cards().get(0).keyword().equals("SIMPLE")) {
            throw new StatusException(Status.NO_SIMPLE);
        }
        if (!"T".equals(header.find("SIMPLE").value())) {
            throw new StatusException(Status.BAD_SIMPLE);
        }
        int bitpix = (int) header.requireLong("BITPIX", Status.BAD_BITPIX);
        byte[] data = readData(file, offset, ImageHdu.dataSize(bitpix, ImageHdu.readAxes(header)));
        return ImageHdu.read(header, data);
    }

    private static Hdu readExtension(ByteBuffer file, int offset, Header header) throws StatusException {
        String xtension = header.stringValue("XTENSION");
        if (xtension == null) {
            throw new StatusException(Status.NO_XTENSION);
        }
        if (header.longValue("GCOUNT", 1L) != 1) {
            throw new StatusException(Status.BAD_GCOUNT);
        }
        switch (xtension.trim()) {
            case "IMAGE" -> {
                int bitpix = (int) header.requireLong("BITPIX", Status.BAD_BITPIX);
                byte[] data = readData(file, offset, ImageHdu.dataSize(bitpix, ImageHdu.readAxes(header)));
                return ImageHdu.read(header, data);
            }
            case "BINTABLE" -> {
                byte[] data = readData(file, offset, TableHdu.dataSize(header));
                return TableHdu.read(header, data);
            }
            default -> throw new StatusException(Status.UNKNOWN_EXT);
        }
    }

    private static byte[] readData(ByteBuffer file, int offset, long size) throws StatusException {
        int length = Hdu.checkedSize(size);
        if ((long) offset + length > file.limit()) {
            throw new StatusException(Status.END_OF_FILE);
        }
        byte[] data = new byte[length];
        file.get(offset, data);
        return data;
    }

    private static boolean startsWith(ByteBuffer file, int offset, String prefix) {
        for (int i = 0; i < prefix.length(); i++) {
            if (file.get(offset + i) != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    static int padded(int length) {
        return (length + BLOCK_SIZE - 1) / BLOCK_SIZE * BLOCK_SIZE;
    }
}
