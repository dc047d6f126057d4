////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Positions}: ordering and conversion between
 * positions and offsets.
 */
class PositionsTests {

	private static final String TEMPLATE = "{\n  \"parameters\": {},\n  \"outputs\": \"[concat('a')]\"\n}";

	// ------------------------------------------------------------------
	// COMPARATOR / valid()
	// ------------------------------------------------------------------

	@Test
	void testComparatorOrdersByLineThenCharacter() {
		Assertions.assertEquals(0, Positions.COMPARATOR.compare(new Position(2, 4), new Position(2, 4)));
		Assertions.assertTrue(Positions.COMPARATOR.compare(new Position(1, 20), new Position(2, 0)) < 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(new Position(2, 7), new Position(2, 3)) > 0);
	}

	@Test
	void testValidRejectsNegativeCoordinates() {
		Assertions.assertTrue(Positions.valid(new Position(0, 0)));
		Assertions.assertFalse(Positions.valid(new Position(3, -1)));
		Assertions.assertFalse(Positions.valid(new Position(-1, 3)));
	}

	// ------------------------------------------------------------------
	// getOffset()
	// ------------------------------------------------------------------

	@Test
	void testGetOffsetOfOpeningBrace() {
		Assertions.assertEquals(0, Positions.getOffset(TEMPLATE, new Position(0, 0)));
	}

	@Test
	void testGetOffsetInsideExpression() {
		int expected = TEMPLATE.indexOf("concat");
		Assertions.assertEquals(expected, Positions.getOffset(TEMPLATE, new Position(2, 15)));
	}

	@Test
	void testGetOffsetOfLastLine() {
		Assertions.assertEquals(TEMPLATE.length() - 1, Positions.getOffset(TEMPLATE, new Position(3, 0)));
		Assertions.assertEquals(TEMPLATE.length(), Positions.getOffset(TEMPLATE, new Position(3, 1)));
	}

	@Test
	void testGetOffsetEmptyDocument() {
		Assertions.assertEquals(0, Positions.getOffset("", new Position(0, 0)));
		Assertions.assertEquals(-1, Positions.getOffset("", new Position(1, 0)));
	}

	@Test
	void testGetOffsetOutsideDocument() {
		Assertions.assertEquals(-1, Positions.getOffset(TEMPLATE, new Position(9, 0)));
		Assertions.assertEquals(-1, Positions.getOffset(TEMPLATE, new Position(0, 2)));
		Assertions.assertEquals(-1, Positions.getOffset(TEMPLATE, new Position(0, -1)));
		Assertions.assertEquals(-1, Positions.getOffset(null, new Position(0, 0)));
	}

	@Test
	void testGetOffsetNegativeCharacterOnLaterLine() {
		// would otherwise land on the previous line's break
		Assertions.assertEquals(-1, Positions.getOffset(TEMPLATE, new Position(2, -1)));
		Assertions.assertEquals(-1, Positions.getOffset(TEMPLATE, new Position(3, -1)));
	}

	@Test
	void testGetOffsetWithCarriageReturns() {
		String text = "{\r\n  \"a\": 1\r\n}";
		Assertions.assertEquals(1, Positions.getOffset(text, new Position(0, 1)));
		Assertions.assertEquals(-1, Positions.getOffset(text, new Position(0, 2)));
		Assertions.assertEquals(text.indexOf('"'), Positions.getOffset(text, new Position(1, 2)));
		Assertions.assertEquals(text.length() - 1, Positions.getOffset(text, new Position(2, 0)));
	}

	// ------------------------------------------------------------------
	// getPosition()
	// ------------------------------------------------------------------

	@Test
	void testGetPositionStart() {
		Assertions.assertEquals(new Position(0, 0), Positions.getPosition("hello\nworld", 0));
	}

	@Test
	void testGetPositionSecondLine() {
		Assertions.assertEquals(new Position(1, 3), Positions.getPosition("hello\nworld", 9));
	}

	@Test
	void testGetPositionAtLineBreak() {
		Assertions.assertEquals(new Position(0, 5), Positions.getPosition("hello\nworld", 5));
		Assertions.assertEquals(new Position(1, 0), Positions.getPosition("hello\nworld", 6));
	}

	@Test
	void testGetPositionPastEndIsClamped() {
		Assertions.assertEquals(new Position(1, 5), Positions.getPosition("hello\nworld", 100));
	}

	@Test
	void testGetPositionNegativeOffsetThrows() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Positions.getPosition("hello", -1));
	}

	@Test
	void testGetPositionIsInverseOfGetOffset() {
		String text = "{\n  \"a\": \"[concat()]\"\n}";
		for (int offset = 0; offset <= text.length(); offset++) {
			Assertions.assertEquals(offset, Positions.getOffset(text, Positions.getPosition(text, offset)));
		}
	}
}
