package org.fairswap.repository.hsqldb;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Database helper for building, and executing, INSERT INTO ... ON DUPLICATE KEY UPDATE ... statements.
 * <p>
 * Columns, and corresponding values, are bound via close-coupled pairs in a chain thus:
 * <p>
 * {@code SaveHelper helper = new SaveHelper("TableName"); }<br>
 * {@code helper.bind("column_name", someColumnValue).bind("column2", columnValue2); }<br>
 * {@code helper.execute(repository); }<br>
 */
public class HSQLDBSaver {

	private final String table;

	private final List<String> columns = new ArrayList<>();
	private final List<Object> objects = new ArrayList<>();

	/**
	 * Construct a SaveHelper, using SQL Connection and table name.
	 *
	 * @param table
	 */
	public HSQLDBSaver(String table) {
		this.table = table;
	}

	/**
	 * Add a column, and bound value, to be saved when execute() is called.
	 *
	 * @param column
	 * @param value
	 * @return the same HSQLDBSaver object
	 */
	public HSQLDBSaver bind(String column, Object value) {
		columns.add(column);
		objects.add(value);
		return this;
	}

	/**
	 * Build PreparedStatement using bound column-value pairs then execute it.
	 *
	 * @return the result from {@link java.sql.PreparedStatement#executeUpdate()}
	 */
	public int execute(HSQLDBRepository repository) throws SQLException {
		String sql = this.formatInsertWithPlaceholders();

		// Values are bound twice: once for INSERT, once for UPDATE
		Object[] boundValues = new Object[this.objects.size() * 2];
		for (int i = 0; i < this.objects.size(); ++i) {
			boundValues[i] = this.objects.get(i);
			boundValues[this.objects.size() + i] = this.objects.get(i);
		}

		return repository.executeCheckedUpdate(sql, boundValues);
	}

	/**
	 * Format table and column names into an INSERT INTO ... SQL statement.
	 * <p>
	 * Full form is:
	 * <p>
	 * INSERT INTO <I>table</I> (<I>column</I>, ...) VALUES (?, ...) ON DUPLICATE KEY UPDATE <I>column</I>=?, ...
	 * <p>
	 * Note that HSQLDB needs to put into mySQL compatibility mode first via "SET DATABASE SQL SYNTAX MYS TRUE".
	 *
	 * @return String
	 */
	private String formatInsertWithPlaceholders() {
		String[] placeholders = new String[this.columns.size()];
		String[] updates = new String[this.columns.size()];

		for (int i = 0; i < this.columns.size(); ++i) {
			placeholders[i] = "?";
			updates[i] = this.columns.get(i) + " = ?";
		}

		StringBuilder output = new StringBuilder(512);
		output.append("INSERT INTO ");
		output.append(this.table);
		output.append(" (");
		output.append(String.join(", ", this.columns));
		output.append(") VALUES (");
		output.append(String.join(", ", placeholders));
		output.append(") ON DUPLICATE KEY UPDATE ");
		output.append(String.join(", ", updates));

		return output.toString();
	}

}
