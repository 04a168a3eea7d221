package org.fairswap.repository.hsqldb;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.fairswap.data.swap.SwapData;
import org.fairswap.data.swap.TermsData;
import org.fairswap.repository.DataException;
import org.fairswap.repository.SwapRepository;
import org.fairswap.swap.Stage;
import org.fairswap.swap.SwapOutcome;
import org.fairswap.swap.SwapParty;

public class HSQLDBSwapRepository implements SwapRepository {

	private static final String SWAP_COLUMNS = "swap_id, party_a, party_b, collateral_amount, stage, "
			+ "completed_a, completed_b, asset_account_a, quantity_a, asset_account_b, quantity_b, "
			+ "started_when, collateral_when, outcome, updated_when";

	protected HSQLDBRepository repository;

	public HSQLDBSwapRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	private static SwapData swapDataFromResultSet(ResultSet resultSet) throws SQLException {
		long swapId = resultSet.getLong(1);
		String partyA = resultSet.getString(2);
		String partyB = resultSet.getString(3);
		long collateralAmount = resultSet.getLong(4);
		Stage stage = Stage.valueOf(resultSet.getInt(5));
		boolean completedA = resultSet.getBoolean(6);
		boolean completedB = resultSet.getBoolean(7);
		TermsData termsA = new TermsData(resultSet.getString(8), resultSet.getLong(9));
		TermsData termsB = new TermsData(resultSet.getString(10), resultSet.getLong(11));
		long startTimestamp = resultSet.getLong(12);

		Long collateralTimestamp = resultSet.getLong(13);
		if (collateralTimestamp == 0 && resultSet.wasNull())
			collateralTimestamp = null;

		SwapOutcome outcome = SwapOutcome.valueOf(resultSet.getInt(14));
		long updatedTimestamp = resultSet.getLong(15);

		return new SwapData(swapId, partyA, partyB, collateralAmount,
				stage, completedA, completedB,
				termsA, termsB,
				startTimestamp, collateralTimestamp,
				outcome, updatedTimestamp);
	}

	private List<SwapData> getSwaps(String sql, Object... bindParams) throws DataException {
		List<SwapData> swaps = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql, bindParams)) {
			if (resultSet == null)
				return swaps;

			do {
				swaps.add(swapDataFromResultSet(resultSet));
			} while (resultSet.next());

			return swaps;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch swaps from repository", e);
		}
	}

	@Override
	public SwapData fromSwapId(long swapId) throws DataException {
		String sql = "SELECT " + SWAP_COLUMNS + " FROM Swaps WHERE swap_id = ?";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, swapId)) {
			if (resultSet == null)
				return null;

			return swapDataFromResultSet(resultSet);
		} catch (SQLException e) {
			throw new DataException("Unable to fetch swap from repository", e);
		}
	}

	@Override
	public boolean exists(long swapId) throws DataException {
		try {
			return this.repository.exists("Swaps", "swap_id = ?", swapId);
		} catch (SQLException e) {
			throw new DataException("Unable to check for swap in repository", e);
		}
	}

	@Override
	public List<SwapData> getSwapsByParty(String address, boolean activeOnly) throws DataException {
		StringBuilder sql = new StringBuilder(512);
		sql.append("SELECT ").append(SWAP_COLUMNS).append(" FROM Swaps WHERE (party_a = ? OR party_b = ?)");

		if (activeOnly)
			sql.append(" AND outcome = ").append(SwapOutcome.ACTIVE.value);

		sql.append(" ORDER BY swap_id DESC");

		return this.getSwaps(sql.toString(), address, address);
	}

	@Override
	public List<SwapData> getActiveSwaps() throws DataException {
		String sql = "SELECT " + SWAP_COLUMNS + " FROM Swaps WHERE outcome = ? ORDER BY swap_id";

		return this.getSwaps(sql, SwapOutcome.ACTIVE.value);
	}

	@Override
	public List<SwapData> getAllSwaps(Integer limit, Integer offset, Boolean reverse) throws DataException {
		StringBuilder sql = new StringBuilder(512);
		sql.append("SELECT ").append(SWAP_COLUMNS).append(" FROM Swaps ORDER BY swap_id");

		if (reverse != null && reverse)
			sql.append(" DESC");

		HSQLDBRepository.limitOffsetSql(sql, limit, offset);

		return this.getSwaps(sql.toString());
	}

	@Override
	public void save(SwapData swapData) throws DataException {
		TermsData termsA = swapData.getTerms(SwapParty.A);
		TermsData termsB = swapData.getTerms(SwapParty.B);

		try {
			if (swapData.getSwapId() == null) {
				String sql = "INSERT INTO Swaps (party_a, party_b, collateral_amount, stage, "
						+ "completed_a, completed_b, asset_account_a, quantity_a, asset_account_b, quantity_b, "
						+ "started_when, collateral_when, outcome, updated_when) "
						+ "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

				this.repository.executeCheckedUpdate(sql,
						swapData.getPartyA(), swapData.getPartyB(), swapData.getCollateralAmount(), swapData.getStage().value,
						swapData.isCompleted(SwapParty.A), swapData.isCompleted(SwapParty.B),
						termsA.getAssetAccount(), termsA.getQuantity(), termsB.getAssetAccount(), termsB.getQuantity(),
						swapData.getStartTimestamp(), swapData.getCollateralTimestamp(),
						swapData.getOutcome().value, swapData.getUpdatedTimestamp());

				Long swapId = this.repository.callIdentity();
				if (swapId == null)
					throw new DataException("Unable to fetch new swap ID from repository");

				swapData.setSwapId(swapId);
				return;
			}

			HSQLDBSaver saveHelper = new HSQLDBSaver("Swaps");

			saveHelper.bind("swap_id", swapData.getSwapId())
					.bind("party_a", swapData.getPartyA())
					.bind("party_b", swapData.getPartyB())
					.bind("collateral_amount", swapData.getCollateralAmount())
					.bind("stage", swapData.getStage().value)
					.bind("completed_a", swapData.isCompleted(SwapParty.A))
					.bind("completed_b", swapData.isCompleted(SwapParty.B))
					.bind("asset_account_a", termsA.getAssetAccount())
					.bind("quantity_a", termsA.getQuantity())
					.bind("asset_account_b", termsB.getAssetAccount())
					.bind("quantity_b", termsB.getQuantity())
					.bind("started_when", swapData.getStartTimestamp())
					.bind("collateral_when", swapData.getCollateralTimestamp())
					.bind("outcome", swapData.getOutcome().value)
					.bind("updated_when", swapData.getUpdatedTimestamp());

			saveHelper.execute(this.repository);
		} catch (SQLException e) {
			throw new DataException("Unable to save swap into repository", e);
		}
	}

	@Override
	public void delete(long swapId) throws DataException {
		try {
			this.repository.delete("Swaps", "swap_id = ?", swapId);
		} catch (SQLException e) {
			throw new DataException("Unable to delete swap from repository", e);
		}
	}

}
