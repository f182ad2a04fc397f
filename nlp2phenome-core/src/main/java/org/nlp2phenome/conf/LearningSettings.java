package org.nlp2phenome.conf;

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

import java.nio.file.Path;
import java.util.List;

import org.nlp2phenome.model.ClassifierAlgorithm;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable settings for one learning run. Built by {@link ConfigLoader} or
 * directly in tests, then passed to whatever needs it.
 */
@Value
@Builder(toBuilder = true)
public class LearningSettings {

	Path annDir;
	Path goldDir;
	Path testAnnDir;
	Path testGoldDir;
	Path conceptMappingFile;
	Path learningModelDir;
	Path entityTypesFile;
	/** Optional. */
	Path ignoreMappingFile;

	/** Example counts at or below this skip training and fall back to querying. */
	@Builder.Default
	int minSampleSize = 5;

	/** Context dimension counts to try, in order. */
	@Builder.Default
	List<Integer> dimensions = List.of(20);

	@Builder.Default
	ClassifierAlgorithm algorithm = ClassifierAlgorithm.MAXENT;

	@Builder.Default
	int iterations = 100;

	@Builder.Default
	int cutoff = 1;

	/** One-hot label dimensions instead of a single index slot. */
	@Builder.Default
	boolean oneHotLabel = true;

	Path gazetteerDir;
	Path fulltextDir;
	Path semehrDumpDir;
}
