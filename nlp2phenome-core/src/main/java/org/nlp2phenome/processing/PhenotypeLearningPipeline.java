package org.nlp2phenome.processing;

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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.nlp2phenome.conf.LearningSettings;
import org.nlp2phenome.eval.LabelPerformance;
import org.nlp2phenome.eval.PerformanceReport;
import org.nlp2phenome.model.ClassifierTrainer;
import org.nlp2phenome.model.DirectoryCorpus;
import org.nlp2phenome.model.DocumentCorpus;
import org.nlp2phenome.model.LabelModel;
import org.nlp2phenome.model.TrainingData;
import org.nlp2phenome.om.GoldDocument;
import org.nlp2phenome.processing.load.LoadResult;
import org.nlp2phenome.processing.recognise.CustomisedRecogniser;
import org.nlp2phenome.umls.ConceptMapping;
import org.nlp2phenome.umls.IgnoreMappings;
import org.nlp2phenome.util.Logger;

/**
 * Batch workflows: rule-based validation of the recognised labels, and the
 * per-label learning experiment (collect dimensions, train, predict on the
 * test corpus, report).
 */
public class PhenotypeLearningPipeline {

	static final String LABEL_MODEL_SUFFIX = ".lm";
	static final String MODEL_SUFFIX = ".bin";

	private final LearningSettings settings;
	private final ConceptMapping conceptMapping;
	private final IgnoreMappings ignoreMappings;
	private final ClassifierTrainer trainer;

	public PhenotypeLearningPipeline(LearningSettings settings, ConceptMapping conceptMapping,
			IgnoreMappings ignoreMappings) {
		this(settings, conceptMapping, ignoreMappings, new ClassifierTrainer(settings));
	}

	PhenotypeLearningPipeline(LearningSettings settings, ConceptMapping conceptMapping, IgnoreMappings ignoreMappings,
			ClassifierTrainer trainer) {
		this.settings = settings;
		this.conceptMapping = conceptMapping;
		this.ignoreMappings = ignoreMappings;
		this.trainer = trainer;
	}

	// ---------- rule-based validation ----------

	public Map<String, LabelPerformance> populateValidationResults(Path annDir, Path goldDir, boolean combined)
			throws IOException {
		return populateValidationResults(DirectoryCorpus.open(annDir, goldDir, conceptMapping), combined);
	}

	/**
	 * Compares mapped labels (or mapped plus customised phenotypes when
	 * {@code combined}) with the gold standard of every document, then logs the
	 * performance table.
	 */
	public Map<String, LabelPerformance> populateValidationResults(DocumentCorpus corpus, boolean combined) {
		Map<String, LabelPerformance> label2performance = new LinkedHashMap<>();
		for (String key : corpus.keys()) {
			LoadResult<GoldDocument> gd = corpus.gold(key);
			if (!gd.isFound())
				continue;
			LoadResult<CustomisedRecogniser> cr = corpus.recogniser(key);
			if (!cr.isFound()) {
				Logger.warn("No usable annotations for {} ({})", key, cr.getStatus());
				continue;
			}
			if (combined) {
				cr.get().validateCombinedPerformance(gd.get().getEssEntities(), label2performance);
			} else {
				cr.get().validateMappedPerformance(gd.get().getEssEntities(), label2performance);
			}
		}
		PerformanceReport.log(label2performance);
		return label2performance;
	}

	// ---------- learning ----------

	public Path labelModelFile(String label) {
		return settings.getLearningModelDir().resolve(label + LABEL_MODEL_SUFFIX);
	}

	public Path classifierFile(String label) {
		return settings.getLearningModelDir().resolve(label + "_" + trainer.getAlgorithm().name() + MODEL_SUFFIX);
	}

	/**
	 * Builds a fresh label model from the training corpus, trains the classifier
	 * for {@code dim} context dimensions and saves both.
	 */
	public LabelModel learnPredictionModel(DocumentCorpus trainCorpus, String label, int dim) throws IOException {
		return learnPredictionModel(trainCorpus, label, dim, false);
	}

	/**
	 * @param reuseLabelModel load {@code <label>.lm} when it exists instead of
	 *                        collecting dimensions again; a reused model is not
	 *                        written back
	 */
	public LabelModel learnPredictionModel(DocumentCorpus trainCorpus, String label, int dim,
			boolean reuseLabelModel) throws IOException {
		Path lmFile = labelModelFile(label);
		boolean changed = false;
		LabelModel lm;
		if (reuseLabelModel && Files.isRegularFile(lmFile)) {
			lm = LabelModel.deserialise(lmFile);
		} else {
			changed = true;
			lm = new LabelModel(label);
			lm.collectWeightedDimensions(trainCorpus);
		}
		lm.setUseOneDimensionForLabel(!settings.isOneHotLabel());
		lm.setMaxDimensions(dim);

		TrainingData data = lm.loadData(trainCorpus, ignoreMappings.forLabel(label));
		trainer.train(data, lm, classifierFile(label));

		if (changed) {
			lm.serialise(lmFile);
			Logger.debug("{} saved", lmFile);
		}
		return lm;
	}

	/** Scores the saved models for {@code label} on the test corpus. */
	public void predictLabel(DocumentCorpus testCorpus, String label, int dim, LabelPerformance performance)
			throws IOException {
		LabelModel lm = LabelModel.deserialise(labelModelFile(label));
		lm.setMaxDimensions(dim);
		TrainingData data = lm.loadData(testCorpus, ignoreMappings.forLabel(label));
		if (data.size() > 0)
			Logger.debug("dimensions {}", data.getX().get(0).length);
		trainer.predictUseModel(data, classifierFile(label), performance);
	}

	/** Runs the experiment for every configured label and dimension setting. */
	public Map<String, LabelPerformance> runLearningExperiment() throws IOException {
		DocumentCorpus train = DirectoryCorpus.open(settings.getAnnDir(), settings.getGoldDir(), conceptMapping);
		DocumentCorpus test = DirectoryCorpus.open(settings.getTestAnnDir(), settings.getTestGoldDir(),
				conceptMapping);
		return runLearningExperiment(readLabels(settings.getEntityTypesFile()), train, test);
	}

	/**
	 * One {@link LabelPerformance} per label and dimension, named
	 * {@code "<label> dim[<k>]"}; the table is logged after each label.
	 */
	public Map<String, LabelPerformance> runLearningExperiment(List<String> labels, DocumentCorpus train,
			DocumentCorpus test) throws IOException {
		Map<String, LabelPerformance> results = new LinkedHashMap<>();
		for (String lbl : labels) {
			Logger.info("working on [{}]", lbl);
			for (int dim : settings.getDimensions()) {
				Logger.info("dimension setting: {}", dim);
				learnPredictionModel(train, lbl, dim);
				String pl = lbl + " dim[" + dim + "]";
				LabelPerformance performance = new LabelPerformance(pl);
				results.put(pl, performance);
				predictLabel(test, lbl, dim, performance);
			}
			PerformanceReport.log(results);
		}
		return results;
	}

	/** Non-blank, trimmed lines of the entity types file. */
	public static List<String> readLabels(Path entityTypesFile) throws IOException {
		return Files.readAllLines(entityTypesFile, StandardCharsets.UTF_8).stream()
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.collect(Collectors.toList());
	}
}
