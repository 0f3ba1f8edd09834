/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.errors;

/**
 * A column or HDU identifier that could not be resolved. When the failure was
 * reported by the engine, the {@link EngineException} is attached as the cause.
 */
public final class AddressException extends FitsException {

    private static final long serialVersionUID = 1L;

    private final String identifier;

    public AddressException(String identifier) {
        super("Cannot resolve '" + identifier + "'");
        this.identifier = identifier;
    }

    public AddressException(String identifier, EngineException cause) {
        super("Cannot resolve '" + identifier + "'", cause);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ADDRESS;
    }
}
