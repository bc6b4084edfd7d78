package io.cadence.timeline;

import io.cadence.api.TimeSignature;

/**
 * A bar or beat line for a renderer to draw.
 *
 * @param position      step position of the line
 * @param timeSignature meter in effect at the line; for a bar line on a meter
 *                      change this is the new meter
 */
public record GridLine(double position, TimeSignature timeSignature) {}
