package ml.crf.object;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A class representing a single data point (an ordered list of tokens, e.g. one sentence).
 * Sequences are immutable, relabeling produces a new sequence of the same length.
 */
public final class Sequence implements Serializable {

	private static final long serialVersionUID = 1L;

	/** Prefix of the pseudo attribute returned for positions outside the sequence */
	public static final String BOUNDARY = "_B";

	private final List<Token> tokens;

	public Sequence(List<Token> tokens){
		this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
	}

	public Sequence(Token[] tokens){
		this(Arrays.asList(tokens));
	}

	public int size(){
		return tokens.size();
	}

	public boolean isEmpty(){
		return tokens.isEmpty();
	}

	public Token get(int position){
		return tokens.get(position);
	}

	public List<Token> tokens(){
		return tokens;
	}

	public Token[] toArray(){
		return tokens.toArray(new Token[tokens.size()]);
	}

	/**
	 * Return the attribute in the given column at the given position.
	 * Positions before the start give "_B-1", "_B-2", ..., positions past the end give "_B+1", "_B+2", ...
	 * @param position
	 * @param column
	 * @return
	 */
	public String getFeatureAt(int position, int column){
		if(position < 0){
			return BOUNDARY+position;
		}
		if(position >= tokens.size()){
			return BOUNDARY+"+"+(position-tokens.size()+1);
		}
		Token token = tokens.get(position);
		if(column >= token.size()){
			throw new IllegalArgumentException(String.format("Column %d is out of range for token at position %d (%d columns)", column, position, token.size()));
		}
		return token.tag(column);
	}

	public String[] labels(){
		String[] result = new String[tokens.size()];
		for(int i=0; i<result.length; i++){
			result[i] = tokens.get(i).label();
		}
		return result;
	}

	/**
	 * Return a new sequence whose tokens carry the given labels, attributes are untouched
	 * @param labels
	 * @return
	 */
	public Sequence withLabels(String[] labels){
		if(labels.length != tokens.size()){
			throw new IllegalArgumentException(String.format("Expected %d labels, got %d", tokens.size(), labels.length));
		}
		List<Token> result = new ArrayList<Token>(tokens.size());
		for(int i=0; i<labels.length; i++){
			result.add(tokens.get(i).withLabel(labels[i]));
		}
		return new Sequence(result);
	}

	/**
	 * Count the positions at which this sequence and the gold sequence carry the same label
	 * @param gold
	 * @return
	 */
	public int compare(Sequence gold){
		if(gold.size() != size()){
			throw new IllegalArgumentException(String.format("Cannot compare sequences of length %d and %d", size(), gold.size()));
		}
		int correct = 0;
		for(int i=0; i<tokens.size(); i++){
			String label = tokens.get(i).label();
			if(label != null && label.equals(gold.get(i).label())){
				correct++;
			}
		}
		return correct;
	}

	/**
	 * Serialize the tokens joined by tab
	 * @return
	 */
	public String serialize(){
		StringBuilder result = new StringBuilder();
		for(Token token: tokens){
			if(result.length() > 0) result.append("\t");
			result.append(token.serialize());
		}
		return result.toString();
	}

	public static Sequence deserialize(String source){
		List<Token> tokens = new ArrayList<Token>();
		if(!source.isEmpty()){
			for(String token: source.split("\t")){
				tokens.add(Token.deserialize(token));
			}
		}
		return new Sequence(tokens);
	}

	public String toString(){
		StringBuilder result = new StringBuilder();
		for(Token token: tokens){
			if(result.length() > 0) result.append(" ");
			result.append(token.toString());
		}
		return result.toString();
	}

	public String conllString(){
		StringBuilder result = new StringBuilder();
		for(Token token: tokens){
			result.append(token.conllString()+"\n");
		}
		return result.toString();
	}

	@Override
	public boolean equals(Object o){
		if(o instanceof Sequence){
			return tokens.equals(((Sequence)o).tokens);
		}
		return false;
	}

	@Override
	public int hashCode(){
		return tokens.hashCode();
	}
}
