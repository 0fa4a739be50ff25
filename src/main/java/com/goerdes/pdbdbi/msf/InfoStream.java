package com.goerdes.pdbdbi.msf;

/**
 * The PDB-wide Info stream, as far as the DBI stream depends on it.
 */
public interface InfoStream {

    /**
     * @return the age of the PDB, incremented each time the PDB is rewritten
     */
    long getAge();

}
