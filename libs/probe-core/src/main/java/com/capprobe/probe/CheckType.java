package com.capprobe.probe;

/**
 * Which verdict of a probe a cached result belongs to.
 */
public enum CheckType {

    /** Cheap existence check. */
    PRESENCE,

    /** Existence plus a functional check of the located capability. */
    FUNCTIONAL
}
