package com.goerdes.pdbdbi.model;

/**
 * A section contribution in either of its two record layouts.
 */
public interface SectionContribution {

    /**
     * Dispatches to the visitor method matching this record's layout.
     *
     * @param visitor the visitor to call
     */
    void accept(SectionContribVisitor visitor);

}
