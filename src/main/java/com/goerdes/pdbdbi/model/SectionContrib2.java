package com.goerdes.pdbdbi.model;

/**
 * A V2 section contribution: the V60 record followed by the index of the
 * section in the COFF section table.
 *
 * @param base         the V60 fields
 * @param sectionCoff  COFF section index
 */
public record SectionContrib2(SectionContrib base, long sectionCoff) implements SectionContribution {

    public static final int SIZE = SectionContrib.SIZE + 4;

    @Override
    public void accept(SectionContribVisitor visitor) {
        visitor.visit(this);
    }
}
