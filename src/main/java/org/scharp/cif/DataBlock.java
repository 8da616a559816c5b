///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A data block, which begins with a {@code data_<name>} heading.
 * <p>
 * In addition to the data items and loops of every {@link Block}, a data block may contain save frames.  Instances
 * of this class are immutable.  They are created with a {@link DataBlock.Builder}:
 * </p>
 * <pre>
 * DataBlock block = DataBlock.builder().
 *     name("1abc").
 *     item("entry.id", Value.of("1ABC")).
 *     item("cell.length_a", Value.of(10.5)).
 *     loop(loop).
 *     build();
 * </pre>
 */
public final class DataBlock extends Block {
    private final Map<String, SaveFrame> frames;

    /**
     * A builder class for {@link DataBlock}.
     */
    public final static class Builder extends Block.Builder<Builder> {
        private final Map<String, SaveFrame> frames;

        private Builder() {
            frames = new LinkedHashMap<>();
        }

        @Override
        Builder self() {
            return this;
        }

        /**
         * Adds a save frame to the data block.
         *
         * @param saveFrame
         *     The save frame to add.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code saveFrame} is {@code null}.
         * @throws IllegalArgumentException
         *     if the data block already has a save frame with the same name.
         */
        public Builder saveFrame(SaveFrame saveFrame) {
            ArgumentUtil.checkNotNull(saveFrame, "saveFrame");
            if (containsSaveFrame(saveFrame.name())) {
                throw new IllegalArgumentException(
                    "data block already has a save frame named \"" + saveFrame.name() + "\"");
            }
            frames.put(saveFrame.name(), saveFrame);
            return this;
        }

        boolean containsSaveFrame(String lowerCaseName) {
            return frames.containsKey(lowerCaseName);
        }

        /**
         * Builds the immutable {@code DataBlock}.
         *
         * @return A {@code DataBlock}
         *
         * @throws IllegalStateException
         *     if the name hasn't been set.
         */
        public DataBlock build() {
            checkNameSet();
            return new DataBlock(this);
        }
    }

    /**
     * Creates a new DataBlock builder with no name, items, loops, or save frames.
     * <p>
     * The name must be set before invoking {@link Builder#build build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private DataBlock(Builder builder) {
        super(builder);
        this.frames = new LinkedHashMap<>(builder.frames);
    }

    /**
     * Gets the save frames of this data block.
     * <p>
     * The returned map is not modifiable.  Its iteration order is the order in which the frames were added.
     * </p>
     *
     * @return A map of lower-case names to save frames.  This is never {@code null}.
     */
    public Map<String, SaveFrame> frames() {
        return Collections.unmodifiableMap(frames);
    }

    /**
     * Gets a save frame by name.
     *
     * @param name
     *     The frame's name, without the {@code save_} prefix.  This is matched without regard to case.
     *
     * @return The save frame, or {@code null} if this data block has no save frame with the given name.
     */
    public SaveFrame saveFrame(String name) {
        ArgumentUtil.checkNotNull(name, "name");
        return frames.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), frames);
    }

    @Override
    public boolean equals(Object other) {
        return super.equals(other) && List.copyOf(frames.values()).equals(
            List.copyOf(((DataBlock) other).frames.values()));
    }

    @Override
    public String toString() {
        return "data_" + name();
    }
}
