package de.tu_berlin.coga.jlpp.parse;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import de.tu_berlin.coga.jlpp.exceptions.LPParseException;
import de.tu_berlin.coga.jlpp.exceptions.LPParseException.Kind;

public class ConstraintExtractorTest {

	private static final List<Variable> X1_X2 = ImmutableList.of(new Variable("x1", 0), new Variable("x2", 1));

	@Test
	public void twoConstraints() throws LPParseException {
		Constraints constraints = ConstraintExtractor.extract(Segment.of("x1 + x2 <= 4\nx1 - x2 >= 1\n"), X1_X2);

		assertEquals(2, constraints.size());
		assertArrayEquals(new double[] { 1, 1 }, constraints.a()[0], 0.0);
		assertArrayEquals(new double[] { 1, -1 }, constraints.a()[1], 0.0);
		assertArrayEquals(new int[] { -1, 1 }, constraints.eqin());
		assertArrayEquals(new double[] { 4, 1 }, constraints.b(), 0.0);
	}

	@Test
	public void equalityAndMissingVariable() throws LPParseException {
		Constraints constraints = ConstraintExtractor.extract(Segment.of("3x2 = 2"), X1_X2);

		assertArrayEquals(new double[] { 0, 3 }, constraints.a()[0], 0.0);
		assertArrayEquals(new int[] { 0 }, constraints.eqin());
	}

	@Test
	public void rightHandSideFormats() throws LPParseException {
		Constraints constraints = ConstraintExtractor.extract(
				Segment.of("x1 >= -3.5\nx1 <= 1e1\nx1 <= +.5\nx1 <= 2.\nx1 <= 1 000"), X1_X2);

		assertArrayEquals(new double[] { -3.5, 10, 0.5, 2, 1000 }, constraints.b(), 0.0);
	}

	@Test
	public void relationMaySpanWhitespace() throws LPParseException {
		Constraints constraints = ConstraintExtractor.extract(Segment.of("x1 < = 4"), X1_X2);

		assertArrayEquals(new int[] { -1 }, constraints.eqin());
		assertArrayEquals(new double[] { 4 }, constraints.b(), 0.0);
	}

	@Test
	public void blankLinesAreSkipped() throws LPParseException {
		Constraints constraints = ConstraintExtractor.extract(Segment.of("\nx1 <= 1\n   \n\r\nx2 <= 2\n"), X1_X2);

		assertEquals(2, constraints.size());
	}

	@Test
	public void missingRelation() {
		LPParseException e = assertThrows(LPParseException.class,
				() -> ConstraintExtractor.extract(Segment.of("x1 <= 1\n\n  x1 + x2 4"), X1_X2));

		assertEquals(Kind.MALFORMED_CONSTRAINT, e.getKind());
		assertEquals(2, e.getLine());
		assertEquals("x1 + x2 4", e.getText());
		assertEquals(3, e.getSourceLine());
		assertEquals(3, e.getColumn());
	}

	@Test
	public void twoRelations() {
		LPParseException e = assertThrows(LPParseException.class,
				() -> ConstraintExtractor.extract(Segment.of("0 <= x1 <= 3"), X1_X2));

		assertEquals(Kind.MALFORMED_CONSTRAINT, e.getKind());
		assertEquals(1, e.getLine());
	}

	@Test
	public void noLeftSide() {
		LPParseException e = assertThrows(LPParseException.class,
				() -> ConstraintExtractor.extract(Segment.of("<= 4"), X1_X2));

		assertEquals(Kind.EMPTY_LEFT_SIDE, e.getKind());
	}

	@Test
	public void zeroLeftSide() {
		LPParseException e = assertThrows(LPParseException.class,
				() -> ConstraintExtractor.extract(Segment.of("0x1 + 0x2 >= 4"), X1_X2));

		assertEquals(Kind.EMPTY_LEFT_SIDE, e.getKind());
		assertEquals("0x1 + 0x2 >= 4", e.getText());
	}

	@Test
	public void noRightSide() {
		LPParseException e = assertThrows(LPParseException.class,
				() -> ConstraintExtractor.extract(Segment.of("x1 + x2 =   "), X1_X2));

		assertEquals(Kind.EMPTY_RIGHT_SIDE, e.getKind());
		assertEquals(9, e.getColumn());
	}

	@Test
	public void variableOnRightSide() {
		LPParseException e = assertThrows(LPParseException.class,
				() -> ConstraintExtractor.extract(Segment.of("x1 <= x2"), X1_X2));

		assertEquals(Kind.INVALID_NUMBER, e.getKind());
		assertEquals("x2", e.getDetail());
		assertEquals(7, e.getColumn());
	}

	@Test
	public void rightSideTooLarge() {
		LPParseException e = assertThrows(LPParseException.class,
				() -> ConstraintExtractor.extract(Segment.of("x1 <= 1\nx1 <= 1e400"), X1_X2));

		assertEquals(Kind.INVALID_NUMBER, e.getKind());
		assertEquals(2, e.getLine());
		assertEquals("1e400", e.getDetail());
	}

	@Test
	public void brokenLeftSide() {
		LPParseException e = assertThrows(LPParseException.class,
				() -> ConstraintExtractor.extract(Segment.of("2.5x1 <= 3"), X1_X2));

		assertEquals(Kind.UNEXPECTED_TOKEN, e.getKind());
	}
}
