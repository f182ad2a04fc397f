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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;

import org.nlp2phenome.conf.LearningSettings;
import org.nlp2phenome.eval.LabelPerformance;
import org.nlp2phenome.util.Logger;

import opennlp.tools.ml.AbstractEventTrainer;
import opennlp.tools.ml.EventTrainer;
import opennlp.tools.ml.TrainerFactory;
import opennlp.tools.ml.model.AbstractModel;
import opennlp.tools.ml.model.Event;
import opennlp.tools.ml.model.GenericModelReader;
import opennlp.tools.ml.model.GenericModelWriter;
import opennlp.tools.ml.model.MaxentModel;
import opennlp.tools.util.ObjectStreamUtils;
import opennlp.tools.util.TrainingParameters;

/**
 * Fits and applies the per-label classifier.
 * <p>
 * Each encoded vector becomes an OpenNLP {@link Event} whose context holds one
 * {@code f<i>=<value>} predicate per slot and whose outcome is {@code "1"} or
 * {@code "0"}. When there are too few examples no classifier is trained and
 * prediction falls back to accepting every detected mention.
 */
public class ClassifierTrainer {

	static final String POSITIVE = "1";
	static final String NEGATIVE = "0";

	private final ClassifierAlgorithm algorithm;
	private final int iterations;
	private final int cutoff;
	private final int minSampleSize;

	public ClassifierTrainer(LearningSettings settings) {
		this(settings.getAlgorithm(), settings.getIterations(), settings.getCutoff(), settings.getMinSampleSize());
	}

	public ClassifierTrainer(ClassifierAlgorithm algorithm, int iterations, int cutoff, int minSampleSize) {
		this.algorithm = algorithm;
		this.iterations = iterations;
		this.cutoff = cutoff;
		this.minSampleSize = minSampleSize;
	}

	public ClassifierAlgorithm getAlgorithm() {
		return algorithm;
	}

	/**
	 * Trains on {@code data} and writes the model to {@code modelFile}.
	 * <p>
	 * With {@code minSampleSize} examples or fewer, or when every example has
	 * the same outcome, nothing is trained and any model left at
	 * {@code modelFile} by an earlier run is deleted. The model is written in
	 * OpenNLP's binary format, so {@code modelFile} should end in {@code .bin}.
	 *
	 * @return true if a model was written
	 * @throws IOException if training or writing the model fails
	 */
	public boolean train(TrainingData data, LabelModel labelModel, Path modelFile) throws IOException {
		if (data.size() <= minSampleSize) {
			Logger.warn("not enough data found for prediction: {} ({} examples)", labelModel.getLabel(),
					data.size());
			removeStale(modelFile);
			return false;
		}
		if (new HashSet<>(data.getY()).size() < 2) {
			Logger.warn("only one outcome in the training data for {} ({} examples), not trained",
					labelModel.getLabel(), data.size());
			removeStale(modelFile);
			return false;
		}
		EventTrainer trainer = TrainerFactory.getEventTrainer(trainingParameters(), new HashMap<>());
		MaxentModel model = trainer.train(ObjectStreamUtils.createObjectStream(toEvents(data)));
		if (modelFile.getParent() != null)
			Files.createDirectories(modelFile.getParent());
		new GenericModelWriter((AbstractModel) model, modelFile.toFile()).persist();
		Logger.info("model file saved to {}", modelFile);
		return true;
	}

	/**
	 * Scores {@code data} against gold labels into {@code performance}.
	 * <p>
	 * Without a model file, or with {@code minSampleSize} examples or fewer,
	 * every example is predicted positive. When a model file exists the
	 * false negatives and multiple true positives counted while loading the
	 * data are added first.
	 *
	 * @throws IOException if the model file exists but cannot be read
	 */
	public void predictUseModel(TrainingData data, Path modelFile, LabelPerformance performance) throws IOException {
		MaxentModel model = null;
		if (!Files.isRegularFile(modelFile)) {
			Logger.info("model file NOT FOUND: {}", modelFile);
		} else {
			model = new GenericModelReader(modelFile.toFile()).getModel();
			if (data.getFalseNegatives() > 0) {
				Logger.debug("missed instances: {}", data.getFalseNegatives());
				performance.increaseFalseNegative(data.getFalseNegatives());
			}
			if (data.getMultipleTruePositives() > 0)
				performance.increaseTruePositive(data.getMultipleTruePositives());
		}

		List<Integer> predictions = new ArrayList<>(data.size());
		if (model == null || data.size() <= minSampleSize) {
			Logger.warn("using querying instead of predicting for {}", performance.getLabel());
			for (int i = 0; i < data.size(); i++)
				predictions.add(1);
		} else {
			for (int[] x : data.getX()) {
				String best = model.getBestOutcome(model.eval(context(x)));
				predictions.add(POSITIVE.equals(best) ? 1 : 0);
			}
			Logger.info("instance size {}", predictions.size());
		}

		for (int i = 0; i < predictions.size(); i++) {
			int p = predictions.get(i);
			int y = data.getY().get(i);
			if (p == y) {
				if (p == 1)
					performance.increaseTruePositive();
			} else if (p == 1) {
				performance.increaseFalsePositive();
			} else {
				performance.increaseFalseNegative();
			}
		}
	}

	private static void removeStale(Path modelFile) throws IOException {
		if (Files.deleteIfExists(modelFile)) {
			Logger.info("stale model file removed: {}", modelFile);
		}
	}

	TrainingParameters trainingParameters() {
		TrainingParameters params = new TrainingParameters();
		params.put(TrainingParameters.ALGORITHM_PARAM, algorithm.getTrainerName());
		params.put(TrainingParameters.ITERATIONS_PARAM, Integer.toString(iterations));
		params.put(TrainingParameters.CUTOFF_PARAM, Integer.toString(cutoff));
		// keep events in memory
		params.put(AbstractEventTrainer.DATA_INDEXER_PARAM, AbstractEventTrainer.DATA_INDEXER_ONE_PASS_VALUE);
		return params;
	}

	static List<Event> toEvents(TrainingData data) {
		List<Event> events = new ArrayList<>(data.size());
		for (int i = 0; i < data.size(); i++) {
			events.add(new Event(data.getY().get(i) == 1 ? POSITIVE : NEGATIVE, context(data.getX().get(i))));
		}
		return events;
	}

	static String[] context(int[] x) {
		String[] ctx = new String[x.length];
		for (int i = 0; i < x.length; i++) {
			ctx[i] = "f" + i + "=" + x[i];
		}
		return ctx;
	}
}
