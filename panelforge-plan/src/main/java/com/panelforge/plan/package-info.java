/**
 * Promotion plan input: the JSON model ({@code model}) and plan-level invariant checks ({@code validation}).
 * <p>
 * A plan names one master grid image, the output directory, the grid shape as {@code "CxR"}
 * (columns x rows) and the panels to promote, each addressed by {@code [row, col]}. Plan-level
 * violations are fatal and reported before any panel is touched.
 */
package com.panelforge.plan;
