package org.javai.nl2sql.join;

public enum JoinType {
	INNER,
	LEFT
}
