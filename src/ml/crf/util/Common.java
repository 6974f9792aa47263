package ml.crf.util;

public class Common {

	public static class AccumulatorResult{
		public double value;
		public int maxIdx;

		public AccumulatorResult(double value, int maxIdx){
			this.value = value;
			this.maxIdx = maxIdx;
		}

		public AccumulatorResult(double value){
			this(value, -1);
		}
	}

	/**
	 * Return the maximum value in the given double array, ignoring NaN.
	 * Will also set the index of the maximum value in the array.
	 * On ties the lowest index wins, and when every value is NaN the index is 0.
	 * @param values
	 * @return
	 */
	public static AccumulatorResult max(double[] values){
		return max(values, 0, values.length);
	}

	/**
	 * Same as {@link #max(double[])} restricted to values[offset, offset+length).
	 * The returned index is relative to offset.
	 * @param values
	 * @param offset
	 * @param length
	 * @return
	 */
	public static AccumulatorResult max(double[] values, int offset, int length){
		double result = Double.NEGATIVE_INFINITY;
		int parentIdx = -1;
		for(int i=0; i<length; i++){
			double value = values[offset+i];
			if(Double.isNaN(value)) continue;
			if(parentIdx == -1 || Double.compare(value, result) > 0){
				result = value;
				parentIdx = i;
			}
		}
		if(parentIdx == -1 && length > 0){
			parentIdx = 0;
		}
		return new AccumulatorResult(result, parentIdx);
	}

	/**
	 * Return the sum of values[indices[i]+shift] over all i, skipping negative indices
	 * @param values
	 * @param indices
	 * @param shift
	 * @return
	 */
	public static double sum(double[] values, int[] indices, int shift){
		double result = 0;
		for(int index: indices){
			if(index < 0) continue;
			result += values[index+shift];
		}
		return result;
	}
}
