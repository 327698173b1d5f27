// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

/**
 * The files of a binary dictionary directory.
 */
public enum DictionaryFile {

    BASE("base.dat.gz"),
    CHECK("check.dat.gz"),
    TOKEN_INFO("tid.dat.gz"),
    TOKEN_INFO_FEATURES("tid_pos.dat.gz"),
    TOKEN_INFO_TARGET_MAP("tid_map.dat.gz"),
    CONNECTION_COSTS("cc.dat.gz"),
    UNKNOWN("unk.dat.gz"),
    UNKNOWN_FEATURES("unk_pos.dat.gz"),
    UNKNOWN_TARGET_MAP("unk_map.dat.gz"),
    CHARACTER_CATEGORIES("unk_char.dat.gz"),
    COMPATIBLE_CHARACTER_CATEGORIES("unk_compat.dat.gz"),
    INVOKE_DEFINITIONS("unk_invoke.dat.gz");

    private final String fileName;

    DictionaryFile(String fileName) {
        this.fileName = fileName;
    }

    /** Returns the name of this file, which is gzip compressed */
    public String fileName() { return fileName; }

    /** Returns the name of the uncompressed variant of this file */
    public String uncompressedFileName() {
        return fileName.substring(0, fileName.length() - ".gz".length());
    }

}
