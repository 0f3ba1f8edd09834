/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import dev.fitsio.engine.HduType;
import dev.fitsio.engine.Status;

/**
 * A primary array or IMAGE extension.
 */
final class ImageHdu extends Hdu {

    private static final double TWO_TO_63 = 9.223372036854775808E18;

    private StorageType storage;
    private long[] naxes;

    private ImageHdu(Header header, byte[] data, StorageType storage, long[] naxes) {
        super(header, data);
        this.storage = storage;
        this.naxes = naxes;
    }

    static ImageHdu emptyPrimary() {
        ImageHdu hdu = new ImageHdu(new Header(), new byte[0], StorageType.UNSIGNED_BYTE, new long[0]);
        hdu.syncHeader(true);
        return hdu;
    }

    /**
     * Creates an image of zeros for a BITPIX code, including the codes of the
     * types stored with an offset.
     */
    static ImageHdu create(int bitpix, long[] naxes) throws StatusException {
        ImageHdu hdu = new ImageHdu(new Header(), new byte[0], StorageType.UNSIGNED_BYTE, new long[0]);
        hdu.reshape(bitpix, naxes);
        hdu.syncHeader(false);
        return hdu;
    }

    static ImageHdu read(Header header, byte[] data) throws StatusException {
        StorageType storage = StorageType.forBitpix((int) header.requireLong("BITPIX", Status.BAD_BITPIX));
        if (storage == null) {
            throw new StatusException(Status.BAD_BITPIX);
        }
        return new ImageHdu(header, data, storage, readAxes(header));
    }

    static long[] readAxes(Header header) throws StatusException {
        long naxis = header.requireLong("NAXIS", Status.BAD_NAXIS);
        if (naxis < 0 || naxis > 999) {
            throw new StatusException(Status.BAD_NAXIS);
        }
        long[] naxes = new long[(int) naxis];
        for (int i = 0; i < naxes.length; i++) {
            naxes[i] = header.requireLong("NAXIS" + (i + 1), Status.BAD_NAXES);
            if (naxes[i] < 0) {
                throw new StatusException(Status.BAD_NAXES);
            }
        }
        return naxes;
    }

    static long dataSize(int bitpix, long[] naxes) {
        if (naxes.length == 0) {
            return 0;
        }
        long count = 1;
        for (long axis : naxes) {
            count *= axis;
        }
        return count * Math.abs(bitpix) / 8;
    }

    @Override
    int typeCode() {
        return HduType.IMAGE.code();
    }

    @Override
    ImageHdu copy() {
        return new ImageHdu(header.copy(), data.clone(), storage, naxes.clone());
    }

    StorageType storage() {
        return storage;
    }

    long[] naxes() {
        return naxes;
    }

    long pixelCount() {
        if (naxes.length == 0) {
            return 0;
        }
        long count = 1;
        for (long axis : naxes) {
            count *= axis;
        }
        return count;
    }

    ValueConverter converter() throws StatusException {
        return new ValueConverter(storage, header.doubleValue("BSCALE", 1.0), header.doubleValue("BZERO", 0.0));
    }

    /**
     * The BITPIX code of the type the pixels represent once BZERO and BSCALE are applied.
     */
    int equivalentBitpix() throws StatusException {
        double scale = header.doubleValue("BSCALE", 1.0);
        double zero = header.doubleValue("BZERO", 0.0);
        if (scale == 1.0) {
            if (storage == StorageType.UNSIGNED_BYTE && zero == -128) {
                return 10;
            }
            if (storage == StorageType.SHORT && zero == 32768) {
                return 20;
            }
            if (storage == StorageType.INT && zero == 2147483648.0) {
                return 40;
            }
            if (zero == Math.rint(zero)) {
                return storage.bitpix();
            }
        }
        if (!storage.isInteger()) {
            return storage.bitpix();
        }
        return storage == StorageType.UNSIGNED_BYTE || storage == StorageType.SHORT ? -32 : -64;
    }

    /**
     * Changes type and shape, keeping as many leading data bytes as fit.
     */
    void reshape(int bitpix, long[] newAxes) throws StatusException {
        StorageType newStorage;
        double zero = 0;
        switch (bitpix) {
            case 10 -> {
                newStorage = StorageType.UNSIGNED_BYTE;
                zero = -128;
            }
            case 20 -> {
                newStorage = StorageType.SHORT;
                zero = 32768;
            }
            case 40 -> {
                newStorage = StorageType.INT;
                zero = 2147483648.0;
            }
            case 80 -> {
                newStorage = StorageType.LONG;
                zero = TWO_TO_63;
            }
            default -> newStorage = StorageType.forBitpix(bitpix);
        }
        if (newStorage == null) {
            throw new StatusException(Status.BAD_BITPIX);
        }
        for (long axis : newAxes) {
            if (axis < 0) {
                throw new StatusException(Status.NEG_AXIS);
            }
        }
        int size = checkedSize(dataSize(newStorage.bitpix(), newAxes));

        data = Arrays.copyOf(data, size);
        storage = newStorage;
        naxes = newAxes.clone();
        header.remove("BSCALE");
        if (zero != 0) {
            String value = zero == TWO_TO_63 ? "9223372036854775808" : Long.toString((long) zero);
            header.set(new HeaderCard("BZERO", value, "offset data range to that of unsigned"));
            header.set(new HeaderCard("BSCALE", "1", "default scaling factor"));
        }
        else {
            header.remove("BZERO");
        }
    }

    @Override
    void syncHeader(boolean primary) {
        List<HeaderCard> leading = new ArrayList<>();
        if (primary) {
            leading.add(new HeaderCard("SIMPLE", "T", "file does conform to FITS standard"));
        }
        else {
            leading.add(new HeaderCard("XTENSION", "'IMAGE   '", "IMAGE extension"));
        }
        leading.add(new HeaderCard("BITPIX", Integer.toString(storage.bitpix()), "number of bits per data pixel"));
        leading.add(new HeaderCard("NAXIS", Integer.toString(naxes.length), "number of data axes"));
        leading.addAll(axisCards(naxes));
        if (primary) {
            leading.add(new HeaderCard("EXTEND", "T", "FITS dataset may contain extensions"));
        }
        else {
            leading.add(new HeaderCard("PCOUNT", "0", "required keyword; must = 0"));
            leading.add(new HeaderCard("GCOUNT", "1", "required keyword; must = 1"));
        }
        header.removeIf(card -> card.keyword().matches("NAXIS\\d+")
                || card.keyword().equals(primary ? "XTENSION" : "SIMPLE")
                || (!primary && card.keyword().equals("EXTEND"))
                || (primary && (card.keyword().equals("PCOUNT") || card.keyword().equals("GCOUNT"))));
        header.setLeading(leading);
    }
}
