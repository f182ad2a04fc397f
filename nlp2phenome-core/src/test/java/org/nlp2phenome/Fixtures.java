package org.nlp2phenome;

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
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Copies the bundled one-document corpus into a scratch folder so tests can
 * add or remove files freely.
 */
public final class Fixtures {

	private Fixtures() {
	}

	public static Path resource(String name) {
		try {
			return Path.of(Fixtures.class.getResource("/fixtures/" + name).toURI());
		} catch (URISyntaxException e) {
			throw new IllegalStateException(e);
		}
	}

	/** Creates {@code ann/doc1.json} and {@code gold/doc1-ann.xml} under {@code root}. */
	public static void copyCorpus(Path root) throws IOException {
		Path ann = Files.createDirectories(root.resolve("ann"));
		Path gold = Files.createDirectories(root.resolve("gold"));
		Files.copy(resource("ann/doc1.json"), ann.resolve("doc1.json"));
		Files.copy(resource("gold/doc1-ann.xml"), gold.resolve("doc1-ann.xml"));
	}
}
