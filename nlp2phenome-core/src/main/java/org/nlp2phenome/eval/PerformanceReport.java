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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.lang3.StringUtils;
import org.nlp2phenome.util.Logger;

/**
 * Renders per-label performance as a tab-separated table.
 */
public final class PerformanceReport {

	public static final String CHANNEL = "performance";

	static final String BANNER = StringUtils.repeat('*', 10) + "performance" + StringUtils.repeat('*', 10);

	private static final String[] HEADER = { "label", "precision", "recall", "f1", "#insts", "false positive" };

	private static final CSVFormat TABLE = CSVFormat.TDF.builder()
			.setRecordSeparator('\n')
			.setQuote(null)
			.setHeader(HEADER)
			.build();

	private PerformanceReport() {
	}

	/** Banner line followed by one row per label, in map iteration order. */
	public static String format(Map<String, LabelPerformance> label2performance) {
		StringBuilder sb = new StringBuilder(BANNER).append('\n');
		try (CSVPrinter printer = new CSVPrinter(sb, TABLE)) {
			for (Map.Entry<String, LabelPerformance> e : label2performance.entrySet()) {
				LabelPerformance p = e.getValue();
				printer.printRecord(e.getKey(), p.getPrecision(), p.getRecall(), p.getF1(), p.getInstances(),
						p.getFalsePositive());
			}
		} catch (IOException e) {
			// StringBuilder never throws
			throw new UncheckedIOException(e);
		}
		return sb.toString();
	}

	/** Writes the table to the {@value #CHANNEL} log channel. */
	public static void log(Map<String, LabelPerformance> label2performance) {
		Logger.channel(CHANNEL).info("\n{}", format(label2performance));
	}
}
