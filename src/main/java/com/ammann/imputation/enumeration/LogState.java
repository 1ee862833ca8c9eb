/* (C)2026 */
package com.ammann.imputation.enumeration;

/**
 * State of an imputation log entry. Entries are never deleted, only superseded.
 */
public enum LogState {
    ACTIVE,
    SUPERSEDED
}
