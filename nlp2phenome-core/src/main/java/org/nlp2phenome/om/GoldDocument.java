package org.nlp2phenome.om;

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

import java.util.List;

import lombok.Value;

/**
 * A gold-standard (EDIR) document: the hand-curated entities plus the text
 * recovered from its word tokens.
 */
@Value
public class GoldDocument {

	/** Id of the first processed word token; entity offsets are relative to it. */
	int wordOffsetStart;

	List<LabelledEntity> essEntities;

	String fullText;
}
