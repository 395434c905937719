package com.github.micycle1.rstartree;

/**
 * Thrown when a node is found in a state the insertion algorithm can never
 * produce, such as a live slot with no region or payload. Indicates a defect in
 * the tree itself; the tree should be discarded.
 */
public class CorruptNodeException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public CorruptNodeException(String message) {
		super(message);
	}
}
