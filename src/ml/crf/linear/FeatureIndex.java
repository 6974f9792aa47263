package ml.crf.linear;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import ml.crf.object.Sequence;

/**
 * Maps template-derived feature keys to feature IDs using the frozen dictionary of a {@link CRFModel}.
 * <p>
 * Every dictionary entry is the base ID of a block of weights. With L labels, a unigram key ("U...") owns
 * L weights, where node (i, y) fires base+y, and a bigram key ("B...") owns L*L weights, where the edge
 * from label p at position i-1 to label y at position i fires base+p*L+y.
 * <p>
 * An index is bound to one model per decode and only reads the model's dictionary and weights.
 */
public class FeatureIndex {

	public static final String MAXID = "maxid:";
	public static final String COST_FACTOR = "cost-factor:";
	public static final String XSIZE = "xsize:";
	public static final String VERSION = "version:";
	public static final String LABELS = "Labels:";
	public static final String UGRAMS = "UGrams:";
	public static final String BGRAMS = "BGrams:";

	/** The template format version written by {@link #buildHeader} */
	public static final String FORMAT_VERSION = "1.0";

	private Map<String, Integer> dic;
	private double[] alpha;

	private int maxId = -1;
	private double costFactor = 1.0;
	private int xsize = -1;
	private String version = FORMAT_VERSION;
	private List<String> labels = new ArrayList<String>();
	private List<Template> unigramTemplates = new ArrayList<Template>();
	private List<Template> bigramTemplates = new ArrayList<Template>();

	private enum Section {NONE, LABELS, UGRAMS, BGRAMS}

	/**
	 * Bind this index to the dictionary, weights and header of the specified model
	 * @param model
	 * @throws ModelFormatException if the header disagrees with the dictionary or the weights
	 */
	public void readModel(CRFModel model){
		readModel(model, true);
	}

	/**
	 * Same as {@link #readModel(CRFModel)}, optionally skipping the dictionary check for a model that
	 * has already passed it
	 * @param model
	 * @param checkDictionary
	 */
	void readModel(CRFModel model, boolean checkDictionary){
		List<String> head = model.head();
		Section section = Section.NONE;
		for(int i=0; i<head.size(); i++){
			String field = head.get(i);
			switch(field){
			case MAXID:
				maxId = parseInt(head, ++i, MAXID);
				section = Section.NONE;
				break;
			case COST_FACTOR:
				costFactor = parseDouble(head, ++i, COST_FACTOR);
				section = Section.NONE;
				break;
			case XSIZE:
				xsize = parseInt(head, ++i, XSIZE);
				section = Section.NONE;
				break;
			case VERSION:
				version = valueAt(head, ++i, VERSION);
				section = Section.NONE;
				break;
			case LABELS:
				section = Section.LABELS;
				break;
			case UGRAMS:
				section = Section.UGRAMS;
				break;
			case BGRAMS:
				section = Section.BGRAMS;
				break;
			default:
				switch(section){
				case LABELS:
					labels.add(field);
					break;
				case UGRAMS:
					unigramTemplates.add(compile(field, false));
					break;
				case BGRAMS:
					bigramTemplates.add(compile(field, true));
					break;
				default:
					throw new ModelFormatException("Unexpected header field: "+field);
				}
			}
		}
		if(maxId < 0){
			throw new ModelFormatException("Model header declares no "+MAXID+" value");
		}
		if(labels.isEmpty()){
			throw new ModelFormatException("Model header declares no labels");
		}
		if(model.alphaSize() != maxId){
			throw new ModelFormatException(String.format("Model header declares %d weights but the model has %d", maxId, model.alphaSize()));
		}
		if(xsize >= 0){
			for(Template template: templates()){
				if(template.maxColumn() >= xsize){
					throw new ModelFormatException(String.format("Template %s addresses a column beyond xsize %d", template, xsize));
				}
			}
		}
		if(checkDictionary){
			checkDictionary(model.dic());
		}
		labels = Collections.unmodifiableList(labels);
		unigramTemplates = Collections.unmodifiableList(unigramTemplates);
		bigramTemplates = Collections.unmodifiableList(bigramTemplates);
		dic = model.dic();
		alpha = model.weights();
	}

	/**
	 * Verify that the dictionary blocks tile [0, maxId) exactly
	 * @param dic
	 */
	private void checkDictionary(Map<String, Integer> dic){
		int ysize = labels.size();
		long[] blocks = new long[dic.size()];
		int idx = 0;
		for(Map.Entry<String, Integer> entry: dic.entrySet()){
			String key = entry.getKey();
			int id = entry.getValue();
			int size = blockSize(key, ysize);
			if(id < 0 || (long)id+size > maxId){
				throw new ModelFormatException(String.format("Feature %s at %d does not fit in %d weights", key, id, maxId));
			}
			blocks[idx++] = ((long)id << 32) | size;
		}
		Arrays.sort(blocks);
		long expected = 0;
		for(long block: blocks){
			long id = block >>> 32;
			long size = block & 0xFFFFFFFFL;
			if(id != expected){
				throw new ModelFormatException(String.format("Feature blocks are not dense at weight %d", expected));
			}
			expected += size;
		}
		if(expected != maxId){
			throw new ModelFormatException(String.format("Feature blocks cover %d weights but the header declares %d", expected, maxId));
		}
	}

	private static int blockSize(String key, int ysize){
		if(key.startsWith("U")){
			return ysize;
		}
		if(key.startsWith("B")){
			return ysize*ysize;
		}
		throw new ModelFormatException("Feature key must start with U or B: "+key);
	}

	private static Template compile(String template, boolean isBigram){
		Template result = new Template(template);
		if(result.isBigram != isBigram){
			throw new ModelFormatException(String.format("Template %s is listed under %s", template, isBigram ? BGRAMS : UGRAMS));
		}
		return result;
	}

	private static String valueAt(List<String> head, int i, String name){
		if(i >= head.size()){
			throw new ModelFormatException("Missing value for "+name);
		}
		return head.get(i);
	}

	private static int parseInt(List<String> head, int i, String name){
		String value = valueAt(head, i, name);
		try{
			return Integer.parseInt(value);
		} catch (NumberFormatException e){
			throw new ModelFormatException(String.format("Invalid value for %s %s", name, value), e);
		}
	}

	private static double parseDouble(List<String> head, int i, String name){
		String value = valueAt(head, i, name);
		try{
			return Double.parseDouble(value);
		} catch (NumberFormatException e){
			throw new ModelFormatException(String.format("Invalid value for %s %s", name, value), e);
		}
	}

	/**
	 * Resolve the active features of every node and edge of the tagger's lattice.
	 * Keys missing from the dictionary are dropped: the model has no weight for them.
	 * @param tagger
	 */
	public void buildFeatures(Tagger tagger){
		Sequence sequence = tagger.sequence();
		int n = sequence.size();
		int[][] nodeFeatures = new int[n][];
		int[][] edgeFeatures = new int[n][];
		for(int position=0; position<n; position++){
			nodeFeatures[position] = lookup(unigramTemplates, sequence, position);
			edgeFeatures[position] = position == 0 ? new int[0] : lookup(bigramTemplates, sequence, position);
		}
		tagger.setFeatures(nodeFeatures, edgeFeatures);
	}

	private int[] lookup(List<Template> templates, Sequence sequence, int position){
		int[] result = new int[templates.size()];
		int size = 0;
		for(Template template: templates){
			Integer id = dic.get(template.apply(sequence, position));
			if(id == null) continue;
			result[size++] = id;
		}
		return size == result.length ? result : Arrays.copyOf(result, size);
	}

	/**
	 * Create a model header in the layout read by {@link #readModel(CRFModel)}
	 * @param maxId
	 * @param costFactor
	 * @param xsize
	 * @param labels
	 * @param unigramTemplates
	 * @param bigramTemplates
	 * @return
	 */
	public static List<String> buildHeader(int maxId, double costFactor, int xsize, List<String> labels,
			List<String> unigramTemplates, List<String> bigramTemplates){
		List<String> head = new ArrayList<String>();
		head.add(MAXID);
		head.add(Integer.toString(maxId));
		head.add(COST_FACTOR);
		head.add(Double.toString(costFactor));
		head.add(XSIZE);
		head.add(Integer.toString(xsize));
		head.add(VERSION);
		head.add(FORMAT_VERSION);
		head.add(LABELS);
		head.addAll(labels);
		head.add(UGRAMS);
		head.addAll(unigramTemplates);
		head.add(BGRAMS);
		head.addAll(bigramTemplates);
		return head;
	}

	private List<Template> templates(){
		List<Template> result = new ArrayList<Template>(unigramTemplates);
		result.addAll(bigramTemplates);
		return result;
	}

	public List<String> labels(){
		return labels;
	}

	public String label(int index){
		return labels.get(index);
	}

	public int ysize(){
		return labels.size();
	}

	public int maxId(){
		return maxId;
	}

	public int xsize(){
		return xsize;
	}

	/** The cost factor recorded at training time */
	public double costFactor(){
		return costFactor;
	}

	public String version(){
		return version;
	}

	public List<Template> unigramTemplates(){
		return unigramTemplates;
	}

	public List<Template> bigramTemplates(){
		return bigramTemplates;
	}

	double[] alpha(){
		return alpha;
	}
}
