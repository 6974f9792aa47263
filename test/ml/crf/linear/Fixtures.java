package ml.crf.linear;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.crf.object.Sequence;
import ml.crf.object.Token;

/**
 * Small hand-weighted models shared by the tests.
 */
public class Fixtures {

	public static final List<String> LABELS = Arrays.asList("N", "V");

	/**
	 * Two labels, one word unigram template and the plain bigram template.
	 * <pre>
	 * U00:dog   N=2.0  V=0.0
	 * U00:runs  N=0.0  V=1.0
	 * B         N-&gt;N=-1.0  N-&gt;V=1.0  V-&gt;N=0.5  V-&gt;V=-2.0
	 * </pre>
	 * @return
	 */
	public static CRFModel tinyModel(){
		Map<String, Integer> dic = new LinkedHashMap<String, Integer>();
		dic.put("U00:dog", 0);
		dic.put("U00:runs", 2);
		dic.put("B", 4);
		double[] alpha = {2.0, 0.0, 0.0, 1.0, -1.0, 1.0, 0.5, -2.0};
		List<String> head = FeatureIndex.buildHeader(alpha.length, 1.0, 1, LABELS,
				Arrays.asList("U00:%x[0,0]"), Arrays.asList("B"));
		return new CRFModel(head, dic, alpha);
	}

	public static Sequence sentence(String... words){
		List<Token> tokens = new ArrayList<Token>();
		for(String word: words){
			tokens.add(Token.put(new String[]{word}));
		}
		return new Sequence(tokens);
	}

	public static Sequence tagged(String[] words, String[] labels){
		List<Token> tokens = new ArrayList<Token>();
		for(int i=0; i<words.length; i++){
			tokens.add(Token.put(labels[i], new String[]{words[i], "POS"+i}));
		}
		return new Sequence(tokens);
	}
}
