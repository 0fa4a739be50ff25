package com.goerdes.pdbdbi.model;

/**
 * Receives section contributions without having to know which layout the
 * stream uses.
 */
public interface SectionContribVisitor {

    void visit(SectionContrib contrib);

    /**
     * Visits a V2 record. Unless overridden, only its V60 part is reported.
     */
    default void visit(SectionContrib2 contrib) {
        visit(contrib.base());
    }
}
