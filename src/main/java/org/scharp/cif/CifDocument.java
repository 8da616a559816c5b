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
 * The contents of a CIF: an optional version and a sequence of data blocks.
 * <p>
 * Instances of this class are immutable.  They are either read with {@link CifReader} or created with a
 * {@link CifDocument.Builder}:
 * </p>
 * <pre>
 * CifDocument document = CifDocument.builder().
 *     version("CIF_1.1").
 *     dataBlock(block).
 *     build();
 * </pre>
 */
public final class CifDocument {
    private final String version;
    private final Map<String, DataBlock> dataBlocks;

    /**
     * A builder class for {@link CifDocument}.
     */
    public final static class Builder {
        private String version;
        private final Map<String, DataBlock> dataBlocks;

        /**
         * Creates a {@code CifDocument} builder with no version and no data blocks.
         */
        private Builder() {
            version = "";
            dataBlocks = new LinkedHashMap<>();
        }

        /**
         * Sets the version that is given by the document's magic comment ({@code #\#CIF_1.1}).
         *
         * @param version
         *     The version, without the {@code #\#} prefix, or the empty string for no version.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code version} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code version} is not empty and either doesn't start with {@code CIF_} or contains a character that
         *     is not allowed in a CIF name.
         */
        public Builder version(String version) {
            ArgumentUtil.checkNotNull(version, "version");
            if (!version.isEmpty()) {
                ArgumentUtil.checkName(version, "version");
                if (!version.startsWith("CIF_")) {
                    throw new IllegalArgumentException("version must start with CIF_");
                }
            }
            this.version = version;
            return this;
        }

        /**
         * Adds a data block to the document.  Data blocks are kept in the order in which they are added.
         *
         * @param dataBlock
         *     The data block to add.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code dataBlock} is {@code null}.
         * @throws IllegalArgumentException
         *     if the document already has a data block with the same name.
         */
        public Builder dataBlock(DataBlock dataBlock) {
            ArgumentUtil.checkNotNull(dataBlock, "dataBlock");
            if (containsDataBlock(dataBlock.name())) {
                throw new IllegalArgumentException(
                    "document already has a data block named \"" + dataBlock.name() + "\"");
            }
            dataBlocks.put(dataBlock.name(), dataBlock);
            return this;
        }

        boolean containsDataBlock(String lowerCaseName) {
            return dataBlocks.containsKey(lowerCaseName);
        }

        /**
         * Builds the immutable {@code CifDocument}.  A document without any data blocks is allowed.
         *
         * @return A {@code CifDocument}
         */
        public CifDocument build() {
            return new CifDocument(version, new LinkedHashMap<>(dataBlocks));
        }
    }

    /**
     * Creates a new CifDocument builder with no version and no data blocks.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private CifDocument(String version, Map<String, DataBlock> dataBlocks) {
        this.version = version;
        this.dataBlocks = dataBlocks; // Builder ensures that the library client does not have a reference.
    }

    /**
     * Gets the document's version, as given by its magic comment.
     *
     * @return The version (for example, {@code "CIF_1.1"}), or the empty string if the document has none.  This is
     *     never {@code null}.
     */
    public String version() {
        return version;
    }

    /**
     * @return {@code true}, if the document has a version; {@code false}, otherwise.
     */
    public boolean hasVersion() {
        return !version.isEmpty();
    }

    /**
     * Gets the document's data blocks.
     * <p>
     * The returned map is not modifiable.  Its iteration order is the order of the blocks in the document.
     * </p>
     *
     * @return A map of lower-case names to data blocks.  This is never {@code null}.
     */
    public Map<String, DataBlock> dataBlocks() {
        return Collections.unmodifiableMap(dataBlocks);
    }

    /**
     * Gets a data block by name.
     *
     * @param name
     *     The block's name, without the {@code data_} prefix.  This is matched without regard to case.
     *
     * @return The data block, or {@code null} if the document has no data block with the given name.
     */
    public DataBlock dataBlock(String name) {
        ArgumentUtil.checkNotNull(name, "name");
        return dataBlocks.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, dataBlocks);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CifDocument otherDocument)) {
            return false;
        }
        return version.equals(otherDocument.version) &&
            List.copyOf(dataBlocks.values()).equals(List.copyOf(otherDocument.dataBlocks.values()));
    }

    @Override
    public String toString() {
        return "CifDocument" + dataBlocks.keySet();
    }
}
