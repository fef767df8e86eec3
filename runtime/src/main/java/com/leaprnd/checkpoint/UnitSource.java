package com.leaprnd.checkpoint;

import java.util.List;

public interface UnitSource {

	/**
	 * @return every available identifier, sorted ascending
	 */
	List<String> getIdentifiers();

	/**
	 * @throws UnitNotFoundException if {@code identifier} is not available
	 */
	Migration load(String identifier);

}
