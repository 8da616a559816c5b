///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

/**
 * A named sub-block of a data block, delimited by {@code save_<name>} and a bare {@code save_}.
 * <p>
 * Save frames hold data items and loops just like a data block, but they cannot contain other save frames.  Instances
 * of this class are immutable.  They are created with a {@link SaveFrame.Builder}.
 * </p>
 */
public final class SaveFrame extends Block {

    /**
     * A builder class for {@link SaveFrame}.
     */
    public final static class Builder extends Block.Builder<Builder> {

        private Builder() {
        }

        @Override
        Builder self() {
            return this;
        }

        /**
         * Builds the immutable {@code SaveFrame}.
         *
         * @return A {@code SaveFrame}
         *
         * @throws IllegalStateException
         *     if the name hasn't been set, or if no data item or loop has been added.
         */
        public SaveFrame build() {
            checkNameSet();
            if (items.isEmpty() && loops.isEmpty()) {
                throw new IllegalStateException("a save frame must have at least one data item");
            }
            return new SaveFrame(this);
        }
    }

    /**
     * Creates a new SaveFrame builder with no name, items, or loops.
     * <p>
     * The name and at least one data item or loop must be set before invoking {@link Builder#build build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private SaveFrame(Builder builder) {
        super(builder);
    }

    @Override
    public String toString() {
        return "save_" + name();
    }
}
