package com.goerdes.pdbdbi.model;

/**
 * A V60 section contribution: module {@code imod} contributed {@code size}
 * bytes at {@code offset} of section {@code section}.
 *
 * @param section         1-based section index
 * @param offset          offset of the contribution in the section
 * @param size            byte size of the contribution
 * @param characteristics COFF section characteristics
 * @param imod            index of the contributing module
 * @param dataCrc         CRC of the contributed data
 * @param relocCrc        CRC of the relocations
 */
public record SectionContrib(
        int section,
        int offset,
        int size,
        long characteristics,
        int imod,
        long dataCrc,
        long relocCrc
) implements SectionContribution {

    public static final int SIZE = 28;

    @Override
    public void accept(SectionContribVisitor visitor) {
        visitor.visit(this);
    }
}
