package com.example.UniScout.model;

/**
 * Control signal carried next to the answer text.
 * <ul>
 *   <li>NONE - a normal grounded answer (or a fixed explanatory message)</li>
 *   <li>DENIED - the query is outside the allowed domain</li>
 *   <li>NOT_FOUND - evidence existed but did not answer the question</li>
 * </ul>
 */
public enum Sentinel {
    NONE,
    DENIED,
    NOT_FOUND
}
