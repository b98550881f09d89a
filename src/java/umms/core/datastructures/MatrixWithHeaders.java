package umms.core.datastructures;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;

import Jama.Matrix;

/**
 * A dense matrix with named rows and columns. Expression, trait, eigengene and all
 * derived statistics tables are carried as instances of this class.
 * Row and column names are unique; order is the insertion order.
 */
public class MatrixWithHeaders {
	private Matrix data;
	private LinkedHashMap<String, Integer> columnIndexMap;
	private LinkedHashMap<String, Integer> rowIndexMap;
	private List<String> columns;
	private List<String> rows;

	public MatrixWithHeaders(String inputFile) throws IOException, ParseException {
		BufferedReader br = new BufferedReader(new FileReader(inputFile));
		try {
			initFromReader(br);
		} finally {
			br.close();
		}
	}

	public MatrixWithHeaders(BufferedReader br) throws IOException, ParseException {
		initFromReader(br);
	}

	public MatrixWithHeaders(Matrix data, List<String> rowNames, List<String> colNames) {
		if(data.getRowDimension() != rowNames.size() || data.getColumnDimension() != colNames.size()) {
			throw new IllegalArgumentException("Matrix is " + data.getRowDimension() + "x" + data.getColumnDimension() +
					" but " + rowNames.size() + " row names and " + colNames.size() + " column names were given");
		}
		this.data = data;
		initNameIndexMaps(rowNames, colNames);
	}

	public MatrixWithHeaders(double[][] values, List<String> rowNames, List<String> colNames) {
		this(new Matrix(values, rowNames.size(), colNames.size()), rowNames, colNames);
	}

	public MatrixWithHeaders(List<String> rows, List<String> columns) {
		this.data = new Matrix(rows.size(), columns.size());
		initNameIndexMaps(rows, columns);
	}

	/**
	 * Builds a matrix from column vectors, e.g. one array per gene.
	 */
	public static MatrixWithHeaders fromColumns(double[][] columnValues, List<String> rowNames, List<String> colNames) {
		MatrixWithHeaders rtrn = new MatrixWithHeaders(rowNames, colNames);
		for(int j = 0; j < columnValues.length; j++) {
			rtrn.setColumn(columnValues[j], j);
		}
		return rtrn;
	}

	public void write(BufferedWriter bw, String cornerLabel) throws IOException {
		bw.write(cornerLabel);
		for(String columnName : columns) {
			bw.write("\t");
			bw.write(columnName);
		}
		bw.newLine();
		for(int i = 0; i < rows.size(); i++) {
			bw.write(rows.get(i));
			for(int j = 0; j < columns.size(); j++) {
				bw.write("\t");
				bw.write(String.valueOf(data.get(i, j)));
			}
			bw.newLine();
		}
		bw.flush();
	}

	public void write(String fileName, String cornerLabel) throws IOException {
		BufferedWriter bw = new BufferedWriter(new FileWriter(fileName));
		try {
			write(bw, cornerLabel);
		} finally {
			bw.close();
		}
	}

	public void write(String fileName) throws IOException {
		write(fileName, "");
	}

	public int columnDimension() { return data.getColumnDimension();}
	public int rowDimension() { return data.getRowDimension();}
	public double get(int i, int j) {return data.get(i,j);}

	public double get(String row, String column) {
		return data.get(getRowIndex(row), getColumnIndex(column));
	}

	public double get(String rowName, int colIdx) {return data.get(getRowIndex(rowName), colIdx);}
	public double get(int rowIdx, String colName) {return data.get(rowIdx, getColumnIndex(colName));}

	public void set(int i, int j, double val) {data.set(i, j, val);}

	public void set(String row, String column, double value) {
		data.set(getRowIndex(row), getColumnIndex(column), value);
	}

	public double[] getColumn(int j){
		double[] rtrn=new double[rowDimension()];
		for(int i=0; i<rtrn.length; i++){
			rtrn[i]=data.get(i,j);
		}
		return rtrn;
	}

	public double[] getColumn(String columnName){
		return getColumn(getColumnIndex(columnName));
	}

	public double[] getRow(int i){
		double[] rtrn=new double[columnDimension()];
		for(int j=0; j<rtrn.length; j++){
			rtrn[j]=data.get(i,j);
		}
		return rtrn;
	}

	public double[] getRow(String rowName){
		return getRow(getRowIndex(rowName));
	}

	public void setColumn(double[] vals, int column){
		if(vals.length != rowDimension()) {
			throw new IllegalArgumentException("Column has " + vals.length + " values but the matrix has " + rowDimension() + " rows");
		}
		for(int i=0; i<vals.length; i++){
			data.set(i, column, vals[i]);
		}
	}

	public void setColumn(double[] vals, String column){
		setColumn(vals, getColumnIndex(column));
	}

	public void setRow(double[] vals, int row) {
		if(vals.length != columnDimension()) {
			throw new IllegalArgumentException("Row has " + vals.length + " values but the matrix has " + columnDimension() + " columns");
		}
		for(int j=0; j<vals.length; j++){
			data.set(row, j, vals[j]);
		}
	}

	/**
	 * @return one array per column, the layout used by the correlation and eigengene code
	 */
	public double[][] toColumnArrays() {
		double[][] rtrn = new double[columnDimension()][];
		for(int j = 0; j < rtrn.length; j++) {
			rtrn[j] = getColumn(j);
		}
		return rtrn;
	}

	public int getColumnIndex(String column) {
		Integer idx = columnIndexMap.get(column);
		if(idx == null) {
			throw new IllegalArgumentException("Column " + column + " is not in the matrix");
		}
		return idx;
	}

	public int getRowIndex(String row) {
		Integer idx = rowIndexMap.get(row);
		if(idx == null) {
			throw new IllegalArgumentException("Row " + row + " is not in the matrix");
		}
		return idx;
	}

	public boolean hasColumn(String column) { return columnIndexMap.containsKey(column);}
	public boolean hasRow(String row) { return rowIndexMap.containsKey(row);}

	public List<String> getColumnNames() { return new ArrayList<String>(columns);}
	public List<String> getRowNames() { return new ArrayList<String>(rows);}
	public String getRowName(int i){return rows.get(i);}
	public String getColumnName(int i){return columns.get(i);}

	public Matrix getData() { return data;}

	public MatrixWithHeaders submatrixByColumnNames(Collection<String> columnNames) {
		List<String> cols = new ArrayList<String>(columnNames);
		MatrixWithHeaders rtrn = new MatrixWithHeaders(rows, cols);
		for(int j = 0; j < cols.size(); j++) {
			rtrn.setColumn(getColumn(cols.get(j)), j);
		}
		return rtrn;
	}

	/**
	 * Returns a copy holding the given rows, in the given order.
	 */
	public MatrixWithHeaders submatrixByRowNames(List<String> rowNames) {
		MatrixWithHeaders rtrn = new MatrixWithHeaders(rowNames, columns);
		for(int i = 0; i < rowNames.size(); i++) {
			rtrn.setRow(getRow(rowNames.get(i)), i);
		}
		return rtrn;
	}

	public MatrixWithHeaders transpose() {
		return new MatrixWithHeaders(data.transpose(), columns, rows);
	}

	public MatrixWithHeaders copy() {
		return new MatrixWithHeaders(data.copy(), rows, columns);
	}

	public String toString() {
		return "MatrixWithHeaders[" + rowDimension() + " x " + columnDimension() + "]";
	}

	protected void initFromReader(BufferedReader br) throws IOException, ParseException {
		String header = br.readLine();
		if(header == null) {
			throw new ParseException("Empty matrix file", 0);
		}
		String [] columnNames = header.split("\t");
		List<String> columnNameList = new ArrayList<String> (columnNames.length);
		for(int i = 1; i < columnNames.length; i++){
			columnNameList.add(columnNames[i].trim());
		}

		List<String> rowNameList = new ArrayList<String>();
		List<double[]> rawData = new ArrayList<double[]>();
		String line = null;
		int lineNum = 1;
		while( (line = br.readLine()) != null) {
			lineNum++;
			if(line.trim().length() == 0) {
				continue;
			}
			String [] info = line.split("\t");
			if(info.length != columnNames.length) {
				throw new ParseException("Line " + lineNum + " has " + info.length + " columns but header had " + columnNames.length + " columns", lineNum);
			}
			rowNameList.add(info[0].trim());
			double[] lineData = new double[info.length - 1];
			for(int i = 1 ; i < info.length; i++) {
				lineData[i - 1] = parseValue(info[i], lineNum);
			}
			rawData.add(lineData);
		}

		this.data = new Matrix(rawData.toArray(new double[rawData.size()][]), rowNameList.size(), columnNameList.size());
		initNameIndexMaps(rowNameList, columnNameList);
	}

	private static double parseValue(String token, int lineNum) throws ParseException {
		String value = token.trim();
		if(value.length() == 0 || "NA".equalsIgnoreCase(value) || "NaN".equalsIgnoreCase(value)) {
			return Double.NaN;
		}
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new ParseException("Line " + lineNum + ": " + value + " is not a number", lineNum);
		}
	}

	private void initNameIndexMaps(List<String> rowNames, List<String> colNames) {
		this.rows = new ArrayList<String>(rowNames);
		this.columns = new ArrayList<String>(colNames);
		this.rowIndexMap = indexNames(rows, "row");
		this.columnIndexMap = indexNames(columns, "column");
	}

	private static LinkedHashMap<String, Integer> indexNames(List<String> names, String what) {
		LinkedHashMap<String, Integer> map = new LinkedHashMap<String, Integer>(names.size() * 2);
		for(int i = 0; i < names.size(); i++) {
			if(map.put(names.get(i), i) != null) {
				throw new IllegalArgumentException("Duplicate " + what + " name " + names.get(i));
			}
		}
		return map;
	}
}
