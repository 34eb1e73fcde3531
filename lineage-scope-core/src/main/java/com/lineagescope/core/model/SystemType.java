package com.lineagescope.core.model;

/**
 * Source technology a process was discovered in.
 */
public enum SystemType {
    ABINITIO,
    HADOOP,
    DATABRICKS,
    UNKNOWN
}
