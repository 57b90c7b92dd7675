/**
 * The qualifier algebra: single qualifiers, their conjunctions and disjunctions, and the
 * known-true/known-false sets that variant specialization evaluates them against.
 */
package io.github.eutro.fungraph.core.qual;
