package com.rawstack;

import org.apache.commons.imaging.common.RationalNumber;

import java.util.Locale;

/**
 * Exact exposure time in seconds, kept as a reduced fraction so that long runs
 * of short exposures sum without drift.
 */
public record ExposureDuration(long numerator, long denominator) implements Comparable<ExposureDuration>
{

	public static final ExposureDuration ZERO = new ExposureDuration(0, 1);

	static final long MAX_RATIONAL_TERM = Integer.MAX_VALUE;

	public ExposureDuration
	{
		if (denominator == 0)
		{
			throw new IllegalArgumentException("Exposure denominator must not be zero");
		}
		if (denominator < 0)
		{
			numerator = -numerator;
			denominator = -denominator;
		}
		long g = gcd(numerator, denominator);
		if (g > 1)
		{
			numerator /= g;
			denominator /= g;
		}
	}

	public static ExposureDuration of(long numerator, long denominator)
	{
		return new ExposureDuration(numerator, denominator);
	}

	public static ExposureDuration ofSeconds(long seconds)
	{
		return new ExposureDuration(seconds, 1);
	}

	public static ExposureDuration fromRational(RationalNumber rational)
	{
		return new ExposureDuration(rational.numerator, rational.divisor);
	}

	static long gcd(long a, long b)
	{
		a = Math.abs(a);
		b = Math.abs(b);
		while (b != 0)
		{
			long t = b;
			b = a % b;
			a = t;
		}
		return a;
	}

	static long lcm(long a, long b)
	{
		if (a == 0 || b == 0) return 0;
		return Math.abs(Math.multiplyExact(a / gcd(a, b), b));
	}

	/**
	 * Exact sum. Throws {@link ArithmeticException} if the reduced result no
	 * longer fits in a long fraction.
	 */
	public ExposureDuration plus(ExposureDuration other)
	{
		if (other.numerator == 0) return this;
		if (numerator == 0) return other;
		long common = lcm(denominator, other.denominator);
		long a = Math.multiplyExact(numerator, common / denominator);
		long b = Math.multiplyExact(other.numerator, common / other.denominator);
		return new ExposureDuration(Math.addExact(a, b), common);
	}

	public ExposureDuration minus(ExposureDuration other)
	{
		return plus(new ExposureDuration(Math.negateExact(other.numerator), other.denominator));
	}

	public boolean isZero()
	{
		return numerator == 0;
	}

	public double toSeconds()
	{
		return (double) numerator / denominator;
	}

	public String formatSeconds()
	{
		return String.format(Locale.ROOT, "%.2f", toSeconds());
	}

	/**
	 * Whether both terms fit the signed 32-bit rational that EXIF writing goes
	 * through, so {@link #toRational()} is exact.
	 */
	public boolean fitsRational()
	{
		return numerator >= 0 && numerator <= MAX_RATIONAL_TERM && denominator <= MAX_RATIONAL_TERM;
	}

	/**
	 * Exact when {@link #fitsRational()}, otherwise the nearest rational to
	 * {@link #toSeconds()}.
	 */
	public RationalNumber toRational()
	{
		if (fitsRational())
		{
			return new RationalNumber((int) numerator, (int) denominator);
		}
		return RationalNumber.valueOf(toSeconds());
	}

	@Override
	public int compareTo(ExposureDuration other)
	{
		return Long.compare(
				Math.multiplyExact(numerator, other.denominator),
				Math.multiplyExact(other.numerator, denominator));
	}

	@Override
	public String toString()
	{
		return denominator == 1 ? Long.toString(numerator) : numerator + "/" + denominator;
	}
}
