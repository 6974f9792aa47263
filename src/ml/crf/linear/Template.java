package ml.crf.linear;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ml.crf.object.Sequence;

/**
 * A compiled feature template.
 * A template starts with either "U" or "B" for unigram and bigram features, and can contain zero or more
 * macros in the form of "%x[N,M]", where N is the position relative to the current position and M is the
 * attribute column (0 is usually the surface word). For example "U05:%x[-1,0]/%x[0,0]" or "B".
 */
public class Template implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final Pattern MACRO = Pattern.compile("%x\\[(-?\\d+),(\\d+)\\]");

	public final String template;
	public final int[] relativePos;
	public final int[] featureIdx;
	public final boolean isBigram;

	/** The literal text around the macros, one more entry than there are macros */
	private final String[] fragments;

	public Template(String template){
		if(template == null || template.isEmpty() || (template.charAt(0) != 'U' && template.charAt(0) != 'B')){
			throw new ModelFormatException("Template must start with U or B: "+template);
		}
		this.template = template;
		this.isBigram = template.charAt(0) == 'B';
		List<Integer> positions = new ArrayList<Integer>();
		List<Integer> columns = new ArrayList<Integer>();
		List<String> literals = new ArrayList<String>();
		Matcher matcher = MACRO.matcher(template);
		int last = 0;
		while(matcher.find()){
			positions.add(Integer.parseInt(matcher.group(1)));
			columns.add(Integer.parseInt(matcher.group(2)));
			literals.add(template.substring(last, matcher.start()));
			last = matcher.end();
		}
		literals.add(template.substring(last));
		relativePos = new int[positions.size()];
		featureIdx = new int[columns.size()];
		for(int i=0; i<relativePos.length; i++){
			relativePos[i] = positions.get(i);
			featureIdx[i] = columns.get(i);
		}
		fragments = literals.toArray(new String[literals.size()]);
	}

	/**
	 * The largest attribute column addressed by this template, -1 if there are no macros
	 * @return
	 */
	public int maxColumn(){
		int result = -1;
		for(int column: featureIdx){
			result = Math.max(result, column);
		}
		return result;
	}

	/**
	 * Expand this template at the specified position of the sequence into a feature key, e.g. "U05:the/cat"
	 * @param sequence
	 * @param position
	 * @return
	 */
	public String apply(Sequence sequence, int position){
		StringBuilder key = new StringBuilder(fragments[0]);
		for(int i=0; i<relativePos.length; i++){
			key.append(sequence.getFeatureAt(position+relativePos[i], featureIdx[i]));
			key.append(fragments[i+1]);
		}
		return key.toString();
	}

	public String toString(){
		return template;
	}
}
