package com.goerdes.pdbdbi.dbi;

import com.goerdes.pdbdbi.model.SectionContrib;
import com.goerdes.pdbdbi.model.SectionContrib2;
import com.goerdes.pdbdbi.model.SectionContribVersion;
import com.goerdes.pdbdbi.model.SectionContribVisitor;
import com.goerdes.pdbdbi.model.SectionContribution;

import java.util.List;

/**
 * The decoded section contributions. Only the list matching {@code version}
 * is populated, the other one is always empty.
 */
record SectionContribs(SectionContribVersion version, List<SectionContrib> v60, List<SectionContrib2> v2) {

    List<? extends SectionContribution> active() {
        return version == SectionContribVersion.VER60 ? v60 : v2;
    }

    void visit(SectionContribVisitor visitor) {
        active().forEach(sc -> sc.accept(visitor));
    }
}
