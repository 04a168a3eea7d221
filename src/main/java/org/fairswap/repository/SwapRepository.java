package org.fairswap.repository;

import java.util.List;

import org.fairswap.data.swap.SwapData;

public interface SwapRepository {

	/** Returns swap with given ID, or null if not found. */
	public SwapData fromSwapId(long swapId) throws DataException;

	public boolean exists(long swapId) throws DataException;

	/**
	 * Returns swaps where <tt>address</tt> is either party, newest first.
	 *
	 * @param activeOnly if true, only swaps still in progress
	 */
	public List<SwapData> getSwapsByParty(String address, boolean activeOnly) throws DataException;

	public List<SwapData> getActiveSwaps() throws DataException;

	public List<SwapData> getAllSwaps(Integer limit, Integer offset, Boolean reverse) throws DataException;

	/**
	 * Saves swap, assigning swap ID if this is a new swap.
	 */
	public void save(SwapData swapData) throws DataException;

	public void delete(long swapId) throws DataException;

}
