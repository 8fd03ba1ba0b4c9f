package com.rawstack;

/**
 * What a session does when one of the selected files cannot be decoded.
 */
public enum DecodeErrorPolicy
{
	/** Fail the whole session at the first unreadable file. */
	ABORT,
	/** Report the file, leave it out of the stack and its exposure out of the total. */
	SKIP
}
