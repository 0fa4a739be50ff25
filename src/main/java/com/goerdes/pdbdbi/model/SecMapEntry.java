package com.goerdes.pdbdbi.model;

/**
 * One slot of the section map. The fields are carried as they are stored.
 *
 * @param flags         descriptor flags
 * @param ovl           logical overlay number
 * @param group         group index into the descriptor array
 * @param frame         frame index
 * @param secName       byte index of the segment or group name, or 0xFFFF
 * @param className     byte index of the class name, or 0xFFFF
 * @param offset        byte offset of the logical segment within the physical one
 * @param secByteLength byte count of the segment or group
 */
public record SecMapEntry(
        int flags,
        int ovl,
        int group,
        int frame,
        int secName,
        int className,
        long offset,
        long secByteLength
) {

    public static final int SIZE = 20;

}
