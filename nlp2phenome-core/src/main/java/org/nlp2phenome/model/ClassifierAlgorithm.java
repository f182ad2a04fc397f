package org.nlp2phenome.model;

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

/**
 * Event trainers available for the per-label classifier. The trainer name is
 * the value OpenNLP expects for its {@code Algorithm} training parameter.
 */
public enum ClassifierAlgorithm {
	MAXENT("MAXENT"),
	MAXENT_QN("MAXENT_QN"),
	PERCEPTRON("PERCEPTRON"),
	NAIVEBAYES("NAIVEBAYES");

	private final String trainerName;

	ClassifierAlgorithm(String trainerName) {
		this.trainerName = trainerName;
	}

	public String getTrainerName() {
		return trainerName;
	}
}
