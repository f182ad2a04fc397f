package org.nlp2phenome.util;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class LoggerTest {

	@Test
	void placeholders_are_filled_in_order() {
		assertEquals("stroke tp: 3, fp: 1", Logger.format("{} tp: {}, fp: {}", "stroke", 3, 1));
	}

	@Test
	void surplus_arguments_are_appended() {
		assertEquals("model saved a.model 2", Logger.format("model saved", "a.model", 2));
		assertEquals("{} left", Logger.format("{} left"));
	}

	@Test
	void null_template() {
		assertEquals("null", Logger.format(null, "x"));
	}

	@Test
	void channels_are_shared_by_name() {
		assertSame(Logger.channel("performance"), Logger.channel("performance"));
		assertEquals("performance", Logger.channel("performance").getName());
	}
}
