package com.goerdes.pdbdbi.model;

/**
 * A COFF section header copied from the section header stream.
 *
 * @param name                 section name, NUL padding removed
 * @param virtualSize          size of the section when loaded
 * @param virtualAddress       RVA of the section
 * @param sizeOfRawData        size of the initialized data in the image file
 * @param pointerToRawData     file offset of the section data
 * @param pointerToRelocations file offset of the relocation entries
 * @param pointerToLinenumbers file offset of the line number entries
 * @param numberOfRelocations  number of relocation entries
 * @param numberOfLinenumbers  number of line number entries
 * @param characteristics      section flags
 */
public record CoffSection(
        String name,
        long virtualSize,
        long virtualAddress,
        long sizeOfRawData,
        long pointerToRawData,
        long pointerToRelocations,
        long pointerToLinenumbers,
        int numberOfRelocations,
        int numberOfLinenumbers,
        long characteristics
) {

    public static final int SIZE = 40;

    public static final int NAME_SIZE = 8;

}
