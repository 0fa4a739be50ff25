package com.goerdes.pdbdbi.model;

/**
 * Frame pointer omission record describing the stack frame of one function.
 *
 * @param offset     start RVA of the function
 * @param size       byte size of the function
 * @param numLocals  number of local variables, in dwords
 * @param numParams  size of the parameters, in dwords
 * @param attributes packed prolog size, saved registers and frame flags
 */
public record FpoData(long offset, long size, long numLocals, int numParams, int attributes) {

    public static final int SIZE = 16;

    public int prologSize() {
        return attributes & 0xFF;
    }

    public int savedRegisters() {
        return (attributes >> 8) & 0x7;
    }

    public boolean hasSeh() {
        return (attributes & 0x0800) != 0;
    }

    public boolean usesBasePointer() {
        return (attributes & 0x1000) != 0;
    }

    public int frameType() {
        return (attributes >> 14) & 0x3;
    }
}
