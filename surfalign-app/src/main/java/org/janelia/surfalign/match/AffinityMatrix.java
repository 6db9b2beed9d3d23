package org.janelia.surfalign.match;

import java.io.Serializable;
import java.util.Arrays;

import org.janelia.surfalign.DegenerateStateException;

/**
 * Non-negative soft correspondence weights between the elements of two feature sets.
 * Entry (i, j) is the weight linking source element i to target element j.
 *
 * The matrix is stored row sparse: each row keeps only the columns it links to (sorted ascending)
 * and every other entry is exactly zero.  Instances are immutable.
 */
public class AffinityMatrix
        implements Serializable {

    /** Tolerance used when checking whether rows are normalized. */
    public static final double ROW_SUM_TOLERANCE = 1e-9;

    private final int numberOfRows;
    private final int numberOfColumns;
    private final int[][] rowColumns;
    private final double[][] rowValues;

    /**
     * @param  numberOfRows     number of source elements.
     * @param  numberOfColumns  number of target elements.
     * @param  rowColumns       linked target columns for each row, sorted ascending without duplicates.
     * @param  rowValues        weights parallel to rowColumns.
     *                          Both row arrays are copied, later changes to them do not affect this matrix.
     *
     * @throws IllegalArgumentException
     *   if the row data is inconsistent with the matrix shape or contains negative or non-finite weights.
     */
    public AffinityMatrix(final int numberOfRows,
                          final int numberOfColumns,
                          final int[][] rowColumns,
                          final double[][] rowValues)
            throws IllegalArgumentException {

        if ((numberOfRows < 0) || (numberOfColumns < 0)) {
            throw new IllegalArgumentException("invalid shape (" + numberOfRows + ", " + numberOfColumns + ")");
        }

        if ((rowColumns.length != numberOfRows) || (rowValues.length != numberOfRows)) {
            throw new IllegalArgumentException("row data does not match " + numberOfRows + " rows");
        }

        for (int row = 0; row < numberOfRows; row++) {
            final int[] columns = rowColumns[row];
            final double[] values = rowValues[row];
            if (columns.length != values.length) {
                throw new IllegalArgumentException("row " + row + " has " + columns.length + " columns but " +
                                                   values.length + " values");
            }
            for (int n = 0; n < columns.length; n++) {
                if ((columns[n] < 0) || (columns[n] >= numberOfColumns)) {
                    throw new IllegalArgumentException("row " + row + " references column " + columns[n] +
                                                       " outside [0, " + numberOfColumns + ")");
                }
                if ((n > 0) && (columns[n] <= columns[n - 1])) {
                    throw new IllegalArgumentException("columns for row " + row + " are not strictly ascending");
                }
                if (! (Double.isFinite(values[n]) && (values[n] >= 0.0))) {
                    throw new IllegalArgumentException("row " + row + " has invalid weight " + values[n]);
                }
            }
        }

        this.numberOfRows = numberOfRows;
        this.numberOfColumns = numberOfColumns;
        this.rowColumns = new int[numberOfRows][];
        this.rowValues = new double[numberOfRows][];
        for (int row = 0; row < numberOfRows; row++) {
            this.rowColumns[row] = rowColumns[row].clone();
            this.rowValues[row] = rowValues[row].clone();
        }
    }

    /**
     * @return sparse matrix holding the non-zero entries of the specified dense array.
     */
    public static AffinityMatrix fromDenseArray(final double[][] dense,
                                                final int numberOfColumns)
            throws IllegalArgumentException {

        final int[][] rowColumns = new int[dense.length][];
        final double[][] rowValues = new double[dense.length][];

        for (int row = 0; row < dense.length; row++) {
            if (dense[row].length != numberOfColumns) {
                throw new IllegalArgumentException("row " + row + " has " + dense[row].length +
                                                   " columns instead of " + numberOfColumns);
            }
            int count = 0;
            for (final double value : dense[row]) {
                if (value != 0.0) {
                    count++;
                }
            }
            rowColumns[row] = new int[count];
            rowValues[row] = new double[count];
            int n = 0;
            for (int column = 0; column < numberOfColumns; column++) {
                if (dense[row][column] != 0.0) {
                    rowColumns[row][n] = column;
                    rowValues[row][n] = dense[row][column];
                    n++;
                }
            }
        }

        return new AffinityMatrix(dense.length, numberOfColumns, rowColumns, rowValues);
    }

    public int getNumberOfRows() {
        return numberOfRows;
    }

    public int getNumberOfColumns() {
        return numberOfColumns;
    }

    public double get(final int row,
                      final int column) {
        final int n = Arrays.binarySearch(rowColumns[row], column);
        return n < 0 ? 0.0 : rowValues[row][n];
    }

    /**
     * @return copy of the (ascending) columns linked by the specified row.
     */
    public int[] getRowColumns(final int row) {
        return rowColumns[row].clone();
    }

    public double getRowSum(final int row) {
        double sum = 0.0;
        for (final double value : rowValues[row]) {
            sum += value;
        }
        return sum;
    }

    public int getNumberOfNonZeroEntries() {
        int count = 0;
        for (final double[] values : rowValues) {
            for (final double value : values) {
                if (value != 0.0) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * @return true if every row sums to 1.0 (within {@link #ROW_SUM_TOLERANCE}).
     */
    public boolean isRowStochastic() {
        for (int row = 0; row < numberOfRows; row++) {
            if (Math.abs(getRowSum(row) - 1.0) > ROW_SUM_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return copy of this matrix with each row scaled to sum to 1.0.
     *
     * @throws DegenerateStateException
     *   if any row has a zero weight sum.
     */
    public AffinityMatrix normalizeRows()
            throws DegenerateStateException {

        final double[][] normalizedValues = new double[numberOfRows][];
        for (int row = 0; row < numberOfRows; row++) {
            final double rowSum = getRowSum(row);
            if (! (rowSum > 0.0)) {
                throw new DegenerateStateException("cannot normalize row " + row + " with weight sum " + rowSum);
            }
            final double[] values = rowValues[row];
            normalizedValues[row] = new double[values.length];
            for (int n = 0; n < values.length; n++) {
                normalizedValues[row][n] = values[n] / rowSum;
            }
        }

        return new AffinityMatrix(numberOfRows, numberOfColumns, rowColumns, normalizedValues);
    }

    public AffinityMatrix transpose() {

        final int[] columnCounts = new int[numberOfColumns];
        for (final int[] columns : rowColumns) {
            for (final int column : columns) {
                columnCounts[column]++;
            }
        }

        final int[][] transposedColumns = new int[numberOfColumns][];
        final double[][] transposedValues = new double[numberOfColumns][];
        for (int column = 0; column < numberOfColumns; column++) {
            transposedColumns[column] = new int[columnCounts[column]];
            transposedValues[column] = new double[columnCounts[column]];
        }

        // visiting rows in ascending order keeps each transposed row sorted
        final int[] fillCounts = new int[numberOfColumns];
        for (int row = 0; row < numberOfRows; row++) {
            final int[] columns = rowColumns[row];
            for (int n = 0; n < columns.length; n++) {
                final int column = columns[n];
                transposedColumns[column][fillCounts[column]] = row;
                transposedValues[column][fillCounts[column]] = rowValues[row][n];
                fillCounts[column]++;
            }
        }

        return new AffinityMatrix(numberOfColumns, numberOfRows, transposedColumns, transposedValues);
    }

    /**
     * @return element-wise sum of this matrix and the specified matrix.
     *
     * @throws IllegalArgumentException
     *   if the matrix shapes differ.
     */
    public AffinityMatrix add(final AffinityMatrix other)
            throws IllegalArgumentException {

        if ((numberOfRows != other.numberOfRows) || (numberOfColumns != other.numberOfColumns)) {
            throw new IllegalArgumentException("cannot add " + other.getShape() + " matrix to " + getShape() +
                                               " matrix");
        }

        final int[][] sumColumns = new int[numberOfRows][];
        final double[][] sumValues = new double[numberOfRows][];

        for (int row = 0; row < numberOfRows; row++) {

            final int[] aColumns = rowColumns[row];
            final double[] aValues = rowValues[row];
            final int[] bColumns = other.rowColumns[row];
            final double[] bValues = other.rowValues[row];

            final int[] columns = new int[aColumns.length + bColumns.length];
            final double[] values = new double[columns.length];

            int a = 0;
            int b = 0;
            int n = 0;
            while ((a < aColumns.length) || (b < bColumns.length)) {
                if ((b == bColumns.length) || ((a < aColumns.length) && (aColumns[a] < bColumns[b]))) {
                    columns[n] = aColumns[a];
                    values[n] = aValues[a];
                    a++;
                } else if ((a == aColumns.length) || (bColumns[b] < aColumns[a])) {
                    columns[n] = bColumns[b];
                    values[n] = bValues[b];
                    b++;
                } else {
                    columns[n] = aColumns[a];
                    values[n] = aValues[a] + bValues[b];
                    a++;
                    b++;
                }
                n++;
            }

            sumColumns[row] = Arrays.copyOf(columns, n);
            sumValues[row] = Arrays.copyOf(values, n);
        }

        return new AffinityMatrix(numberOfRows, numberOfColumns, sumColumns, sumValues);
    }

    /**
     * @return the matrix product of this matrix and the specified (numberOfColumns x m) array.
     *
     * @throws IllegalArgumentException
     *   if the specified array does not have numberOfColumns rows of equal length.
     */
    public double[][] multiply(final double[][] matrix)
            throws IllegalArgumentException {

        if (matrix.length != numberOfColumns) {
            throw new IllegalArgumentException("cannot multiply " + getShape() + " matrix with " + matrix.length +
                                               " rows");
        }

        final int width = matrix.length == 0 ? 0 : matrix[0].length;
        for (final double[] matrixRow : matrix) {
            if (matrixRow.length != width) {
                throw new IllegalArgumentException("cannot multiply with ragged array");
            }
        }

        final double[][] product = new double[numberOfRows][width];
        for (int row = 0; row < numberOfRows; row++) {
            final int[] columns = rowColumns[row];
            final double[] values = rowValues[row];
            final double[] productRow = product[row];
            for (int n = 0; n < columns.length; n++) {
                final double[] matrixRow = matrix[columns[n]];
                for (int d = 0; d < width; d++) {
                    productRow[d] += values[n] * matrixRow[d];
                }
            }
        }

        return product;
    }

    /**
     * @return the product of this matrix and the specified column vector.
     */
    public double[] multiply(final double[] vector)
            throws IllegalArgumentException {

        if (vector.length != numberOfColumns) {
            throw new IllegalArgumentException("cannot multiply " + getShape() + " matrix with vector of length " +
                                               vector.length);
        }

        final double[] product = new double[numberOfRows];
        for (int row = 0; row < numberOfRows; row++) {
            final int[] columns = rowColumns[row];
            final double[] values = rowValues[row];
            for (int n = 0; n < columns.length; n++) {
                product[row] += values[n] * vector[columns[n]];
            }
        }

        return product;
    }

    public double[][] toDenseArray() {
        final double[][] dense = new double[numberOfRows][numberOfColumns];
        for (int row = 0; row < numberOfRows; row++) {
            final int[] columns = rowColumns[row];
            for (int n = 0; n < columns.length; n++) {
                dense[row][columns[n]] = rowValues[row][n];
            }
        }
        return dense;
    }

    public String getShape() {
        return "(" + numberOfRows + ", " + numberOfColumns + ")";
    }

    @Override
    public String toString() {
        return "{ shape: " + getShape() + ", nonZeroEntries: " + getNumberOfNonZeroEntries() + " }";
    }

}
