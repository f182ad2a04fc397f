package org.nlp2phenome.eval;

/*
 * This file is part of NLP2Phenome.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * NLP2Phenome is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * NLP2Phenome is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with NLP2Phenome.  If not, see <https://www.gnu.org/licenses/>.
 */

import lombok.Getter;

/**
 * True positive / false negative / false positive counters for one label, with
 * the derived precision, recall and F1.
 * <p>
 * Metrics are {@code -1} when undefined: precision when nothing was detected,
 * recall when there is nothing to find, F1 when either of those is {@code -1}
 * or exactly zero.
 */
@Getter
public class LabelPerformance {

	public static final double UNDEFINED = -1;

	private final String label;
	private int truePositive;
	private int falseNegative;
	private int falsePositive;

	public LabelPerformance(String label) {
		this.label = label;
	}

	public void increaseTruePositive() {
		increaseTruePositive(1);
	}

	public void increaseTruePositive(int k) {
		truePositive += k;
	}

	public void increaseFalseNegative() {
		increaseFalseNegative(1);
	}

	public void increaseFalseNegative(int k) {
		falseNegative += k;
	}

	public void increaseFalsePositive() {
		increaseFalsePositive(1);
	}

	public void increaseFalsePositive(int k) {
		falsePositive += k;
	}

	public double getPrecision() {
		if (truePositive + falsePositive == 0)
			return UNDEFINED;
		return (double) truePositive / (truePositive + falsePositive);
	}

	public double getRecall() {
		if (truePositive + falseNegative == 0)
			return UNDEFINED;
		return (double) truePositive / (truePositive + falseNegative);
	}

	public double getF1() {
		double p = getPrecision();
		double r = getRecall();
		if (p == UNDEFINED || r == UNDEFINED || p == 0 || r == 0)
			return UNDEFINED;
		return 2 / (1 / p + 1 / r);
	}

	/** Gold instances seen for the label: found plus missed. */
	public int getInstances() {
		return truePositive + falseNegative;
	}

	@Override
	public String toString() {
		return label + " [tp=" + truePositive + ", fn=" + falseNegative + ", fp=" + falsePositive + "]";
	}
}
