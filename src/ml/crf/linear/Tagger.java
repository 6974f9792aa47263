package ml.crf.linear;

import java.util.Arrays;

import ml.crf.object.Sequence;
import ml.crf.util.Common;

/**
 * The lattice of one sequence and the Viterbi decoder running over it.
 * <p>
 * A tagger is used for exactly one decode: {@link #read}, then {@link FeatureIndex#buildFeatures},
 * then {@link #parse}, then {@link #result}. Calling these out of order throws {@link IllegalStateException}.
 * <p>
 * All scratch space is kept in flat arrays, nodes at [i*L + y] and edges at [(i*L + p)*L + y] where
 * p is the label at position i-1.
 */
public class Tagger {

	public enum State {UNINITIALIZED, READ, FEATURES_BUILT, PARSED}

	private final int ysize;
	private double costFactor = 1.0;
	private State state = State.UNINITIALIZED;

	private Sequence sequence;
	private int length;

	/** Base IDs of the unigram features firing at each position */
	private int[][] nodeFeatures;
	/** Base IDs of the bigram features firing on the edges into each position, empty at position 0 */
	private int[][] edgeFeatures;

	private double[] nodeCost;
	private double[] edgeCost;
	private double[] delta;
	private int[] backPointer;
	private int[] result;
	private double bestScore;

	public Tagger(int ysize){
		if(ysize <= 0){
			throw new IllegalArgumentException("A tagger needs at least one label, got "+ysize);
		}
		this.ysize = ysize;
	}

	/**
	 * Set the multiplier applied to every edge potential. 1.0 keeps the model's own decision,
	 * 0 removes the transitions altogether.
	 * @param costFactor
	 */
	public void setCostFactor(double costFactor){
		if(state == State.PARSED){
			throw new IllegalStateException("Cost factor must be set before parsing");
		}
		if(Double.isNaN(costFactor) || Double.isInfinite(costFactor) || costFactor < 0){
			throw new IllegalArgumentException("Cost factor must be a finite non-negative number, got "+costFactor);
		}
		this.costFactor = costFactor;
	}

	public double costFactor(){
		return costFactor;
	}

	/**
	 * Allocate the lattice for the specified sequence
	 * @param sequence
	 * @param featureIndex the index the features will be built with, must have this tagger's label count
	 */
	public void read(Sequence sequence, FeatureIndex featureIndex){
		expect(State.UNINITIALIZED, "read");
		if(featureIndex.ysize() != ysize){
			throw new IllegalArgumentException(String.format("Tagger has %d labels but the feature index has %d", ysize, featureIndex.ysize()));
		}
		this.sequence = sequence;
		this.length = sequence.size();
		nodeCost = new double[length*ysize];
		edgeCost = new double[length*ysize*ysize];
		delta = new double[length*ysize];
		backPointer = new int[length*ysize];
		result = new int[length];
		state = State.READ;
	}

	Sequence sequence(){
		if(state == State.UNINITIALIZED){
			throw new IllegalStateException("No sequence has been read");
		}
		return sequence;
	}

	void setFeatures(int[][] nodeFeatures, int[][] edgeFeatures){
		expect(State.READ, "buildFeatures");
		this.nodeFeatures = nodeFeatures;
		this.edgeFeatures = edgeFeatures;
		state = State.FEATURES_BUILT;
	}

	/**
	 * Compute the potentials from the specified weights and run Viterbi
	 * @param alpha
	 */
	public void parse(double[] alpha){
		expect(State.FEATURES_BUILT, "parse");
		calcCost(alpha);
		viterbi();
		state = State.PARSED;
	}

	private void calcCost(double[] alpha){
		for(int i=0; i<length; i++){
			for(int y=0; y<ysize; y++){
				nodeCost[i*ysize+y] = Common.sum(alpha, nodeFeatures[i], y);
			}
		}
		if(costFactor == 0){
			// edgeCost stays 0, also when the bigram weights sum to an infinity
			return;
		}
		for(int i=1; i<length; i++){
			for(int p=0; p<ysize; p++){
				for(int y=0; y<ysize; y++){
					edgeCost[(i*ysize+p)*ysize+y] = costFactor*Common.sum(alpha, edgeFeatures[i], p*ysize+y);
				}
			}
		}
	}

	private void viterbi(){
		if(length == 0){
			bestScore = 0;
			return;
		}
		System.arraycopy(nodeCost, 0, delta, 0, ysize);
		Arrays.fill(backPointer, 0, ysize, -1);
		double[] values = new double[ysize];
		for(int i=1; i<length; i++){
			int prevOffset = (i-1)*ysize;
			for(int y=0; y<ysize; y++){
				for(int p=0; p<ysize; p++){
					values[p] = delta[prevOffset+p]+edgeCost[(i*ysize+p)*ysize+y];
				}
				Common.AccumulatorResult best = Common.max(values);
				delta[i*ysize+y] = best.value+nodeCost[i*ysize+y];
				backPointer[i*ysize+y] = best.maxIdx;
			}
		}
		Common.AccumulatorResult best = Common.max(delta, (length-1)*ysize, ysize);
		bestScore = best.value;
		int y = best.maxIdx;
		for(int i=length-1; i>=0; i--){
			result[i] = y;
			y = backPointer[i*ysize+y];
		}
	}

	/**
	 * Return the decoded label index at the specified position
	 * @param position
	 * @return
	 */
	public int result(int position){
		expect(State.PARSED, "result");
		return result[position];
	}

	public int[] results(){
		expect(State.PARSED, "results");
		return result.clone();
	}

	/**
	 * Score of the best path, 0 for an empty sequence
	 * @return
	 */
	public double bestScore(){
		expect(State.PARSED, "bestScore");
		return bestScore;
	}

	public int ysize(){
		return ysize;
	}

	public int size(){
		return length;
	}

	public State state(){
		return state;
	}

	private void expect(State expected, String operation){
		if(state != expected){
			throw new IllegalStateException(String.format("Cannot %s in state %s, expected %s", operation, state, expected));
		}
	}
}
