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

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.nlp2phenome.model.ClassifierAlgorithm;
import org.nlp2phenome.util.Logger;

/**
 * Loads NLP2Phenome configuration from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/nlp2phenome.properties</code>
 * from the classpath. You can override this by setting the system property
 * <code>nlp2phenome.config</code> to an absolute path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>All directory-like values are normalized to end with a trailing slash
 * (e.g. <code>/path/to/dir/</code>).</li>
 * <li>Use {@link #validate()} during startup to check for missing required
 * keys, and {@link #toSettings()} to hand the values to the pipeline.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/nlp2phenome.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "nlp2phenome.config";

	// ---- Property keys -------------------------------------------------------
	private static final String K_ANN_DIR = "ANN_DIR";
	private static final String K_GOLD_DIR = "GOLD_DIR";
	private static final String K_TEST_ANN_DIR = "TEST_ANN_DIR";
	private static final String K_TEST_GOLD_DIR = "TEST_GOLD_DIR";
	private static final String K_CONCEPT_MAPPING_FILE = "CONCEPT_MAPPING_FILE";
	private static final String K_LEARNING_MODEL_DIR = "LEARNING_MODEL_DIR";
	private static final String K_ENTITY_TYPES_FILE = "ENTITY_TYPES_FILE";
	private static final String K_IGNORE_MAPPING_FILE = "IGNORE_MAPPING_FILE";

	// Learning
	private static final String K_MIN_SAMPLE_SIZE = "MIN_SAMPLE_SIZE";
	private static final String K_DIMENSIONS = "DIMENSIONS";
	private static final String K_CLASSIFIER_ALGORITHM = "CLASSIFIER_ALGORITHM";
	private static final String K_TRAINING_ITERATIONS = "TRAINING_ITERATIONS";
	private static final String K_TRAINING_CUTOFF = "TRAINING_CUTOFF";
	private static final String K_ONE_HOT_LABEL = "ONE_HOT_LABEL";

	// Optional workflow steps
	private static final String K_GAZETTEER_DIR = "GAZETTEER_DIR";
	private static final String K_FULLTEXT_DIR = "FULLTEXT_DIR";
	private static final String K_SEMEHR_DUMP_DIR = "SEMEHR_DUMP_DIR";

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			} else {
				Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
			}
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Checks the keys the learning workflow needs. Does not fail; returns
	 * human-readable issues so the caller can decide how to proceed.
	 *
	 * @return list of error strings; empty if all required keys look OK
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		requireNonBlank(K_ANN_DIR, issues);
		requireNonBlank(K_GOLD_DIR, issues);
		requireNonBlank(K_TEST_ANN_DIR, issues);
		requireNonBlank(K_TEST_GOLD_DIR, issues);
		requireNonBlank(K_CONCEPT_MAPPING_FILE, issues);
		requireNonBlank(K_LEARNING_MODEL_DIR, issues);
		requireNonBlank(K_ENTITY_TYPES_FILE, issues);

		// Training and test data must not be the same folder
		String train = properties.getProperty(K_ANN_DIR);
		String test = properties.getProperty(K_TEST_ANN_DIR);
		if (train != null && test != null) {
			String nTrain = normalizedDir(train);
			if (!nTrain.isBlank() && nTrain.equals(normalizedDir(test))) {
				issues.add("TEST_ANN_DIR must differ from ANN_DIR.");
			}
		}

		String algo = getOptional(K_CLASSIFIER_ALGORITHM, null);
		if (algo != null && parseAlgorithm(algo) == null) {
			issues.add("Unknown CLASSIFIER_ALGORITHM '" + algo + "'.");
		}
		return issues;
	}

	/** Folder of per-document annotation records used for training. */
	public String getAnnDir() {
		return normalizedDir(getRequired(K_ANN_DIR));
	}

	/** Folder of gold-standard documents used for training. */
	public String getGoldDir() {
		return normalizedDir(getRequired(K_GOLD_DIR));
	}

	public String getTestAnnDir() {
		return normalizedDir(getRequired(K_TEST_ANN_DIR));
	}

	public String getTestGoldDir() {
		return normalizedDir(getRequired(K_TEST_GOLD_DIR));
	}

	/** JSON table mapping each label to its concepts. */
	public String getConceptMappingFile() {
		return getRequired(K_CONCEPT_MAPPING_FILE);
	}

	/** Where label models and classifiers are written. */
	public String getLearningModelDir() {
		return normalizedDir(getRequired(K_LEARNING_MODEL_DIR));
	}

	/** Text file with one target label per line. */
	public String getEntityTypesFile() {
		return getRequired(K_ENTITY_TYPES_FILE);
	}

	/** Optional: per-label concept ids or strings to ignore. */
	public String getIgnoreMappingFile() {
		return getOptional(K_IGNORE_MAPPING_FILE, null);
	}

	public int getMinSampleSize() {
		return getInt(K_MIN_SAMPLE_SIZE, 5);
	}

	/** Comma-separated list of context dimension counts; defaults to 20. */
	public List<Integer> getDimensions() {
		String raw = getOptional(K_DIMENSIONS, "20");
		List<Integer> dims = new ArrayList<>();
		for (String s : raw.split(",")) {
			if (s.isBlank())
				continue;
			try {
				dims.add(Integer.parseInt(s.trim()));
			} catch (NumberFormatException nfe) {
				Logger.warn("Ignoring invalid dimension '{}' in {}", s, K_DIMENSIONS);
			}
		}
		if (dims.isEmpty())
			dims.add(20);
		return dims;
	}

	public ClassifierAlgorithm getClassifierAlgorithm() {
		String raw = getOptional(K_CLASSIFIER_ALGORITHM, ClassifierAlgorithm.MAXENT.name());
		ClassifierAlgorithm algo = parseAlgorithm(raw);
		if (algo == null) {
			Logger.warn("Unknown classifier algorithm '{}'. Using {}", raw, ClassifierAlgorithm.MAXENT);
			return ClassifierAlgorithm.MAXENT;
		}
		return algo;
	}

	public int getTrainingIterations() {
		return getInt(K_TRAINING_ITERATIONS, 100);
	}

	public int getTrainingCutoff() {
		return getInt(K_TRAINING_CUTOFF, 1);
	}

	public boolean isOneHotLabel() {
		return Boolean.parseBoolean(getOptional(K_ONE_HOT_LABEL, "true"));
	}

	/** Optional: output folder for gazetteer lists learnt from the gold standard. */
	public String getGazetteerDir() {
		return normalizedDir(getOptional(K_GAZETTEER_DIR, null));
	}

	/** Optional: output folder for recovered plain text. */
	public String getFulltextDir() {
		return normalizedDir(getOptional(K_FULLTEXT_DIR, null));
	}

	/** Optional: folder of SemEHR dump files to split per document. */
	public String getSemehrDumpDir() {
		return normalizedDir(getOptional(K_SEMEHR_DUMP_DIR, null));
	}

	/**
	 * Snapshot of the configuration as a settings value.
	 *
	 * @throws IllegalStateException if a required key is missing
	 */
	public LearningSettings toSettings() {
		return LearningSettings.builder()
				.annDir(Path.of(getAnnDir()))
				.goldDir(Path.of(getGoldDir()))
				.testAnnDir(Path.of(getTestAnnDir()))
				.testGoldDir(Path.of(getTestGoldDir()))
				.conceptMappingFile(Path.of(getConceptMappingFile()))
				.learningModelDir(Path.of(getLearningModelDir()))
				.entityTypesFile(Path.of(getEntityTypesFile()))
				.ignoreMappingFile(toPath(getIgnoreMappingFile()))
				.minSampleSize(getMinSampleSize())
				.dimensions(List.copyOf(getDimensions()))
				.algorithm(getClassifierAlgorithm())
				.iterations(getTrainingIterations())
				.cutoff(getTrainingCutoff())
				.oneHotLabel(isOneHotLabel())
				.gazetteerDir(toPath(getGazetteerDir()))
				.fulltextDir(toPath(getFulltextDir()))
				.semehrDumpDir(toPath(getSemehrDumpDir()))
				.build();
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null || v.isBlank()) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private int getInt(String key, int defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			return Integer.parseInt(raw);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private static ClassifierAlgorithm parseAlgorithm(String raw) {
		try {
			return ClassifierAlgorithm.valueOf(raw.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			return null;
		}
	}

	private static Path toPath(String value) {
		return value == null ? null : Path.of(value);
	}

	private String normalizedDir(String path) {
		if (path == null || path.isBlank())
			return path;
		String p = path.trim();
		if (!p.endsWith("/"))
			p = p + "/";
		return p;
	}

	private void requireNonBlank(String key, List<String> issues) {
		String v = properties.getProperty(key);
		if (v == null || v.trim().isEmpty()) {
			issues.add("Missing required property: " + key);
		}
	}
}
