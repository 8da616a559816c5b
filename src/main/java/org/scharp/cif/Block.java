///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The contents shared by data blocks and save frames: a name, single data items, and loops.
 * <p>
 * A data tag is either a single item or a column of a loop, never both.  Every tag of a loop maps to the same
 * {@link Loop} instance, so {@link #loops()} usually has more entries than there are loops.  Use
 * {@link #distinctLoops()} to visit each loop once.
 * </p>
 */
public abstract class Block {
    private final String name;
    private final Map<String, Value> items;
    private final Map<String, Loop> loops;

    /**
     * The builder state shared by {@link DataBlock.Builder} and {@link SaveFrame.Builder}.
     *
     * @param <B>
     *     The concrete builder type, so that chained calls keep it.
     */
    public abstract static class Builder<B extends Builder<B>> {
        String name;
        final Map<String, Value> items;
        final Map<String, Loop> loops;

        Builder() {
            items = new LinkedHashMap<>();
            loops = new LinkedHashMap<>();
        }

        abstract B self();

        /**
         * Sets the block's name.
         *
         * @param name
         *     The name, without the {@code data_} or {@code save_} prefix.  This is converted to lower case.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code name} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code name} is empty or contains a character that is not allowed in a CIF name.
         */
        public B name(String name) {
            ArgumentUtil.checkName(name, "name");
            this.name = name.toLowerCase(Locale.ROOT);
            return self();
        }

        /**
         * Adds a single data item.
         *
         * @param tag
         *     The item's data tag, without the leading underscore.  This is converted to lower case.
         * @param value
         *     The item's value.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code tag} or {@code value} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code tag} is empty, contains a character that is not allowed in a CIF name, or is already used by an
         *     item or loop column in this block.
         */
        public B item(String tag, Value value) {
            ArgumentUtil.checkName(tag, "tag");
            ArgumentUtil.checkNotNull(value, "value");

            String lowerCaseTag = tag.toLowerCase(Locale.ROOT);
            checkTagIsNew(lowerCaseTag);
            items.put(lowerCaseTag, value);
            return self();
        }

        /**
         * Adds a loop.  The loop is registered under each of its tags.
         *
         * @param loop
         *     The loop to add.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code loop} is {@code null}.
         * @throws IllegalArgumentException
         *     if any of the loop's tags is already used by an item or loop column in this block.
         */
        public B loop(Loop loop) {
            ArgumentUtil.checkNotNull(loop, "loop");

            // Check all tags before committing to any of them.
            List<String> tags = loop.tags();
            for (String tag : tags) {
                checkTagIsNew(tag);
            }
            for (String tag : tags) {
                loops.put(tag, loop);
            }
            return self();
        }

        boolean containsTag(String lowerCaseTag) {
            return items.containsKey(lowerCaseTag) || loops.containsKey(lowerCaseTag);
        }

        private void checkTagIsNew(String lowerCaseTag) {
            if (containsTag(lowerCaseTag)) {
                throw new IllegalArgumentException("block already has a data item with tag \"" + lowerCaseTag + "\"");
            }
        }

        void checkNameSet() {
            if (name == null) {
                throw new IllegalStateException("name must be set");
            }
        }
    }

    Block(Builder<?> builder) {
        this.name = builder.name;
        this.items = new LinkedHashMap<>(builder.items);
        this.loops = new LinkedHashMap<>(builder.loops);
    }

    /**
     * Gets this block's name.
     *
     * @return The name, in lower case and without the {@code data_} or {@code save_} prefix.  This is never
     *     {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * Gets the single (non-loop) data items of this block.
     * <p>
     * The returned map is not modifiable.  Its iteration order is the order in which the items were added.
     * </p>
     *
     * @return A map of lower-case tags to values.  This is never {@code null}.
     */
    public Map<String, Value> items() {
        return Collections.unmodifiableMap(items);
    }

    /**
     * Gets the loops of this block, keyed by each of their tags.
     * <p>
     * The returned map is not modifiable.
     * </p>
     *
     * @return A map of lower-case tags to the loop that has a column for the tag.  This is never {@code null}.
     */
    public Map<String, Loop> loops() {
        return Collections.unmodifiableMap(loops);
    }

    /**
     * Gets a single data item.
     *
     * @param tag
     *     The data tag, without the leading underscore.  This is matched without regard to case.
     *
     * @return The item's value, or {@code null} if this block has no single item with the given tag.
     */
    public Value item(String tag) {
        ArgumentUtil.checkNotNull(tag, "tag");
        return items.get(tag.toLowerCase(Locale.ROOT));
    }

    /**
     * Gets the loop that has a column for a data tag.
     *
     * @param tag
     *     The data tag, without the leading underscore.  This is matched without regard to case.
     *
     * @return The loop, or {@code null} if no loop in this block has a column with the given tag.
     */
    public Loop loop(String tag) {
        ArgumentUtil.checkNotNull(tag, "tag");
        return loops.get(tag.toLowerCase(Locale.ROOT));
    }

    /**
     * Gets each loop of this block once, in the order in which the loops were added.
     *
     * @return A new list of loops.  This is never {@code null}.
     */
    public List<Loop> distinctLoops() {
        Set<Loop> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Loop> distinct = new ArrayList<>();
        for (Loop loop : loops.values()) {
            if (seen.add(loop)) {
                distinct.add(loop);
            }
        }
        return distinct;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, items);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        Block otherBlock = (Block) other;
        return name.equals(otherBlock.name) &&
            List.copyOf(items.entrySet()).equals(List.copyOf(otherBlock.items.entrySet())) &&
            distinctLoops().equals(otherBlock.distinctLoops());
    }
}
