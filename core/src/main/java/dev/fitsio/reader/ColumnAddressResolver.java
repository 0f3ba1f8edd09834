/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.reader;

import java.util.List;

import dev.fitsio.engine.FitsEngine;
import dev.fitsio.engine.Status;
import dev.fitsio.errors.AddressException;
import dev.fitsio.errors.ErrorTranslator;
import dev.fitsio.errors.FitsException;
import dev.fitsio.schema.ConcreteColumnDescription;
import dev.fitsio.schema.HduInfo;
import dev.fitsio.types.EngineTarget;

/**
 * Resolves column locators to 0-based column indexes.
 * <p>
 * Indexes are passed through as given. Names are first matched
 * case-insensitively against the table's cached columns, then handed to the
 * engine's template lookup, which also understands wildcards.
 * </p>
 */
final class ColumnAddressResolver {

    private ColumnAddressResolver() {
    }

    static int resolve(EngineTarget target, HduInfo.TableInfo table, ColumnLocator locator) throws FitsException {
        if (locator instanceof ColumnLocator.ByIndex byIndex) {
            return byIndex.index();
        }
        String name = ((ColumnLocator.ByName) locator).name();

        List<ConcreteColumnDescription> columns = table.columns();
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equalsIgnoreCase(name)) {
                return i;
            }
        }

        FitsEngine engine = target.engine();
        int[] colnum = new int[1];
        int status = engine.columnNumber(target.file(), false, name, colnum);
        if (status != Status.OK) {
            throw new AddressException(name, ErrorTranslator.engineError(engine, status));
        }
        return colnum[0] - 1;
    }
}
