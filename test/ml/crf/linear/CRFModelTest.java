package ml.crf.linear;

import static ml.crf.linear.Fixtures.sentence;
import static ml.crf.linear.Fixtures.tagged;
import static ml.crf.linear.Fixtures.tinyModel;
import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ml.crf.object.Sequence;
import ml.crf.object.Token;

public class CRFModelTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static CRFModel imprecise(){
		CRFModel model = tinyModel();
		double[] alpha = model.alpha();
		alpha[0] = 0.1;
		alpha[3] = 1.0/3;
		alpha[7] = -2.123456789012;
		return new CRFModel(model.head(), model.dic(), alpha);
	}

	private static void assertFloatEquals(double[] expected, double[] actual){
		assertEquals(expected.length, actual.length);
		for(int i=0; i<expected.length; i++){
			assertEquals((float)expected[i], (float)actual[i], 0.0f);
		}
	}

	@Test
	public void testTextFormat(){
		String text = CRFModel.save(tinyModel());
		String[] sections = text.split("\\|--\\|");
		assertEquals(3, sections.length);
		assertTrue(sections[0].startsWith("maxid:\t8\t"));
		assertEquals("U00:dog|-|0\tU00:runs|-|2\tB|-|4", sections[1]);
		assertEquals("2.0\t0.0\t0.0\t1.0\t-1.0\t1.0\t0.5\t-2.0", sections[2]);
		assertEquals(sections[0]+"|--|"+sections[1], tinyModel().toStringHead());
	}

	@Test
	public void testTextRoundTrip(){
		CRFModel model = imprecise();
		CRFModel loaded = CRFModel.load(CRFModel.save(model));
		assertEquals(model.head(), loaded.head());
		assertEquals(model.dic(), loaded.dic());
		assertEquals(Arrays.asList(model.dic().keySet().toArray()), Arrays.asList(loaded.dic().keySet().toArray()));
		assertFloatEquals(model.alpha(), loaded.alpha());
		assertEquals(tinyModel(), CRFModel.load(CRFModel.save(tinyModel())));
	}

	@Test
	public void testLoadWrongSectionCount(){
		try{
			CRFModel.load("a|b");
			fail("Expected a format error");
		} catch (ModelFormatException e){
			assertEquals(ModelFormatException.INCOMPATIBLE_FORMAT, e.getMessage());
		}
	}

	@Test
	public void testLoadNonIntegerId(){
		try{
			CRFModel.load("a|--|b|-|1\tc|-|x|--|0.1");
			fail("Expected a format error");
		} catch (ModelFormatException e){
			assertEquals(ModelFormatException.INCOMPATIBLE_FORMAT, e.getMessage());
		}
	}

	@Test(expected = ModelFormatException.class)
	public void testLoadMalformedEntry(){
		CRFModel.load("a|--|b1|--|0.1");
	}

	@Test(expected = ModelFormatException.class)
	public void testLoadBadWeight(){
		CRFModel.load("a|--|b|-|1|--|0.1\tnope");
	}

	@Test(expected = ModelFormatException.class)
	public void testLoadTooManySections(){
		CRFModel.load("a|--|b|-|1|--|0.1|--|0.2");
	}

	@Test
	public void testBinaryRoundTrip() throws IOException{
		CRFModel model = imprecise();
		File dir = folder.newFolder("model");
		CRFModel.saveBinaryFile(model, dir.getPath());
		assertTrue(new File(dir, CRFModel.HEAD_FILE).exists());
		assertEquals(4L*model.alphaSize(), new File(dir, CRFModel.ALPHA_FILE).length());
		CRFModel loaded = CRFModel.loadBinaryFile(dir.getPath());
		assertEquals(model.head(), loaded.head());
		assertEquals(model.dic(), loaded.dic());
		assertFloatEquals(model.alpha(), loaded.alpha());
		for(int i=0; i<model.alphaSize(); i++){
			assertEquals((double)(float)model.alpha(i), loaded.alpha(i), 0.0);
		}
	}

	@Test(expected = ModelFormatException.class)
	public void testBinaryShortAlphaFile() throws IOException{
		File dir = folder.newFolder("short");
		CRFModel.saveBinaryFile(tinyModel(), dir.getPath());
		try (DataOutputStream out = new DataOutputStream(new FileOutputStream(new File(dir, CRFModel.ALPHA_FILE)))) {
			out.writeFloat(1.0f);
		}
		CRFModel.loadBinaryFile(dir.getPath());
	}

	@Test(expected = ModelFormatException.class)
	public void testBinaryWeightCountBeyondAlphaFile() throws IOException{
		File dir = folder.newFolder("huge");
		try (FileOutputStream out = new FileOutputStream(new File(dir, CRFModel.HEAD_FILE))) {
			out.write("maxid:\t2000000000|--|B|-|0".getBytes("UTF-8"));
		}
		try (DataOutputStream out = new DataOutputStream(new FileOutputStream(new File(dir, CRFModel.ALPHA_FILE)))) {
			out.writeFloat(1.0f);
		}
		CRFModel.loadBinaryFile(dir.getPath());
	}

	@Test(expected = ModelFormatException.class)
	public void testDuplicateFeatureKey(){
		CRFModel.load("a|--|a|-|0\ta|-|1|--|0.1");
	}

	@Test(expected = ModelFormatException.class)
	public void testBinaryHeadWithWeights() throws IOException{
		File dir = folder.newFolder("full");
		try (FileOutputStream out = new FileOutputStream(new File(dir, CRFModel.HEAD_FILE))) {
			out.write(tinyModel().toString().getBytes("UTF-8"));
		}
		CRFModel.loadBinaryFile(dir.getPath());
	}

	@Test
	public void testPredictKeepsAttributesAndOrder(){
		String[] words = {"dog", "runs", "zebra"};
		Sequence gold = tagged(words, new String[]{"V", "V", "V"});
		List<Sequence> result = tinyModel().predict(Arrays.asList(gold, sentence()));
		assertEquals(2, result.size());
		Sequence predicted = result.get(0);
		assertEquals(gold.size(), predicted.size());
		for(int i=0; i<words.length; i++){
			assertArrayEquals(gold.get(i).tags(), predicted.get(i).tags());
		}
		assertArrayEquals(new String[]{"N", "V", "N"}, predicted.labels());
		assertEquals(0, result.get(1).size());
	}

	@Test
	public void testDefaultCostFactor(){
		CRFModel model = tinyModel();
		List<Sequence> tests = Arrays.asList(sentence("runs", "runs"), sentence("dog", "dog", "runs"));
		assertEquals(model.predict(tests, 1.0), model.predict(tests));
		assertArrayEquals(new String[]{"V", "V"}, model.predict(tests, 0.0).get(0).labels());
		assertArrayEquals(new String[]{"N", "V"}, model.predict(tests).get(0).labels());
	}

	@Test
	public void testParallelPredictMatchesSequential(){
		CRFModel model = tinyModel();
		List<Sequence> tests = Arrays.asList(sentence("runs", "runs"), sentence("dog"), sentence(), sentence("cat", "dog", "runs", "runs"));
		ExecutorService executor = Executors.newFixedThreadPool(3);
		try{
			assertEquals(model.predict(tests, 0.5), model.predict(tests, 0.5, executor));
		} finally {
			executor.shutdown();
		}
	}

	@Test(expected = ModelFormatException.class)
	public void testMalformedModelFailsBeforeDecoding(){
		CRFModel model = tinyModel();
		CRFModel broken = new CRFModel(model.head(), model.dic(), Arrays.copyOf(model.alpha(), 7));
		broken.predict(Arrays.asList(sentence("dog")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTokenWithTooFewColumns(){
		CRFModel model = tinyModel();
		Map<String, Integer> dic = new LinkedHashMap<String, Integer>(model.dic());
		List<String> head = FeatureIndex.buildHeader(8, 1.0, 2, Fixtures.LABELS,
				Arrays.asList("U00:%x[0,1]"), Arrays.asList("B"));
		new CRFModel(head, dic, model.alpha()).decode(sentence("dog"), 1.0);
	}

	@Test
	public void testModelIsImmutable(){
		double[] alpha = tinyModel().alpha();
		CRFModel model = new CRFModel(tinyModel().head(), tinyModel().dic(), alpha);
		alpha[0] = 100;
		model.alpha()[1] = 100;
		assertEquals(tinyModel(), model);
		try{
			model.dic().put("U00:cat", 8);
			fail("The dictionary must be read-only");
		} catch (UnsupportedOperationException e){
			// expected
		}
	}

	@Test
	public void testSerializedCopyDecodesIdentically() throws Exception{
		CRFModel model = tinyModel();
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
			out.writeObject(model);
		}
		CRFModel copy;
		try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
			copy = (CRFModel)in.readObject();
		}
		assertNotSame(model, copy);
		assertEquals(model, copy);
		assertEquals(model.hashCode(), copy.hashCode());
		List<Sequence> tests = Arrays.asList(new Sequence(new Token[]{Token.put("N", new String[]{"runs"}), Token.put(new String[]{"dog"})}));
		assertEquals(model.predict(tests), copy.predict(tests));
	}

	@Test
	public void testLabels(){
		assertEquals(Fixtures.LABELS, tinyModel().getLabels());
	}
}
