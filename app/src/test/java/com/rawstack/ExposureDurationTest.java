package com.rawstack;

import org.apache.commons.imaging.common.RationalNumber;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExposureDurationTest
{

	// --- Normalization ---

	@Test
	void reducesToLowestTerms()
	{
		ExposureDuration d = ExposureDuration.of(10, 1000);
		assertEquals(1, d.numerator());
		assertEquals(100, d.denominator());
	}

	@Test
	void negativeDenominatorMovesSignToNumerator()
	{
		ExposureDuration d = ExposureDuration.of(1, -4);
		assertEquals(-1, d.numerator());
		assertEquals(4, d.denominator());
	}

	@Test
	void zeroHasUnitDenominator()
	{
		assertEquals(ExposureDuration.ZERO, ExposureDuration.of(0, 250));
		assertTrue(ExposureDuration.of(0, 7).isZero());
	}

	@Test
	void rejectsZeroDenominator()
	{
		assertThrows(IllegalArgumentException.class, () -> ExposureDuration.of(1, 0));
	}

	// --- Exact arithmetic ---

	@Test
	void threeHundredthsSumExactly()
	{
		ExposureDuration hundredth = ExposureDuration.of(1, 100);
		ExposureDuration total = hundredth.plus(hundredth).plus(hundredth);
		assertEquals(ExposureDuration.of(3, 100), total);
		assertEquals(3, total.numerator());
		assertEquals(100, total.denominator());
	}

	@Test
	void manyShortExposuresDoNotDrift()
	{
		// 0.1 summed as a double 1000 times is not exactly 100
		ExposureDuration tenth = ExposureDuration.of(1, 10);
		ExposureDuration total = ExposureDuration.ZERO;
		for (int i = 0; i < 1000; i++)
		{
			total = total.plus(tenth);
		}
		assertEquals(ExposureDuration.ofSeconds(100), total);
	}

	@Test
	void mixedDenominators()
	{
		assertEquals(ExposureDuration.of(1, 2), ExposureDuration.of(1, 3).plus(ExposureDuration.of(1, 6)));
		assertEquals(ExposureDuration.of(33, 10), ExposureDuration.ofSeconds(3).plus(ExposureDuration.of(3, 10)));
	}

	@Test
	void minusUndoesPlus()
	{
		ExposureDuration a = ExposureDuration.of(1, 60);
		ExposureDuration b = ExposureDuration.of(1, 250);
		assertEquals(a, a.plus(b).minus(b));
		assertEquals(ExposureDuration.ZERO, b.minus(b));
	}

	@Test
	void ordering()
	{
		assertTrue(ExposureDuration.of(1, 100).compareTo(ExposureDuration.of(1, 60)) < 0);
		assertTrue(ExposureDuration.ofSeconds(2).compareTo(ExposureDuration.of(3, 2)) > 0);
		assertEquals(0, ExposureDuration.of(2, 4).compareTo(ExposureDuration.of(1, 2)));
	}

	// --- Display and conversion ---

	@Test
	void formatsSecondsWithTwoDecimals()
	{
		assertEquals("0.03", ExposureDuration.of(3, 100).formatSeconds());
		assertEquals("30.00", ExposureDuration.ofSeconds(30).formatSeconds());
		assertEquals("0.33", ExposureDuration.of(1, 3).formatSeconds());
	}

	@Test
	void toStringShowsFraction()
	{
		assertEquals("3/100", ExposureDuration.of(3, 100).toString());
		assertEquals("15", ExposureDuration.ofSeconds(15).toString());
	}

	@Test
	void convertsToAndFromRational()
	{
		ExposureDuration d = ExposureDuration.of(1, 250);
		RationalNumber r = d.toRational();
		assertEquals(1, r.numerator);
		assertEquals(250, r.divisor);
		assertEquals(d, ExposureDuration.fromRational(r));
	}

	@Test
	void termsBeyondThirtyOneBitsAreApproximated()
	{
		ExposureDuration exact = ExposureDuration.of(Integer.MAX_VALUE, 1000);
		assertTrue(exact.fitsRational());
		assertEquals(exact, ExposureDuration.fromRational(exact.toRational()));

		// 1/3 + 1/7 + ... + 1/31 no longer fits a 32-bit rational
		ExposureDuration wide = ExposureDuration.of(17362458181L, 20056049013L);
		assertFalse(wide.fitsRational());
		RationalNumber r = wide.toRational();
		assertTrue(r.divisor > 0 && r.divisor <= Integer.MAX_VALUE);
		assertEquals(wide.toSeconds(), r.doubleValue(), 1e-6);
	}

	// --- Overflow ---

	@Test
	void overflowingSumThrows()
	{
		ExposureDuration big = ExposureDuration.of(1, 307444891294245705L);
		assertThrows(ArithmeticException.class, () -> big.plus(ExposureDuration.of(1, 53)));
	}
}
