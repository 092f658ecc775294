package com.libragraph.squash.codecs.api;

public enum StreamDirection {
    COMPRESS,
    DECOMPRESS
}
