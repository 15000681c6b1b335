package net.java.henkan;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.lucene.analysis.util.ClasspathResourceLoader;
import org.apache.lucene.analysis.util.FilesystemResourceLoader;
import org.apache.lucene.analysis.util.ResourceLoader;
import org.apache.lucene.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.java.henkan.connector.Connector;
import net.java.henkan.converter.ImmutableConverter;
import net.java.henkan.dictionary.DictionaryFileReader;
import net.java.henkan.dictionary.DictionaryLookup;
import net.java.henkan.dictionary.FstDictionary;
import net.java.henkan.segmenter.Segmenter;

/**
 * Loads the transition cost table, the segmenter table and the dictionary
 * of one data directory and hands out converters sharing them.
 * <p>
 * A data directory holds {@value #CONNECTOR_FILE}, {@value #SEGMENTER_FILE},
 * {@value #DICTIONARY_FILE} and optionally {@value #OPTIONS_FILE}. A null or
 * empty directory name means the resources next to this class on the
 * classpath.
 * <p>
 * <b>Thread Safety:</b> This class and all its public methods are thread safe.
 * The converters it returns are thread safe as well.
 */
public class HenkanFactory {

  private static final Logger log = LoggerFactory.getLogger(HenkanFactory.class);

  private static final Map<String, HenkanFactory> map = new ConcurrentHashMap<String, HenkanFactory>();
  private static final String EMPTY_DATADIR_KEY = "NO_DATADIR_INSTANCE";

  public static final String CONNECTOR_FILE = "connector.bin";
  public static final String SEGMENTER_FILE = "segmenter.bin";
  public static final String DICTIONARY_FILE = "dictionary.txt";
  public static final String OPTIONS_FILE = "henkan.properties";

  private final Connector connector;
  private final Segmenter segmenter;
  private final DictionaryLookup dictionary;
  private final ConverterOptions options;
  private final ImmutableConverter converter;

  public HenkanFactory(Connector connector, Segmenter segmenter, DictionaryLookup dictionary,
                       ConverterOptions options) {
    this.connector = connector;
    this.segmenter = segmenter;
    this.dictionary = dictionary;
    this.options = options;
    this.converter = new ImmutableConverter(connector, segmenter, dictionary, options);
  }

  /**
   * Returns the shared factory of a data directory, loading it on first use.
   *
   * @param dataDir a data directory, or null for the classpath
   * @throws IOException if a file is missing or malformed
   */
  public static synchronized HenkanFactory getInstance(String dataDir) throws IOException {
    String key = isEmpty(dataDir) ? EMPTY_DATADIR_KEY : dataDir;
    HenkanFactory instance = map.get(key);
    if (instance == null) {
      instance = load(dataDir);
      map.put(key, instance);
    }
    return instance;
  }

  /**
   * Loads a data directory, reading {@value #OPTIONS_FILE} if it is there.
   *
   * @param dataDir a data directory, or null for the classpath
   * @throws IOException if a file is missing or malformed
   */
  public static HenkanFactory load(String dataDir) throws IOException {
    ResourceLoader loader;
    boolean hasOptions;
    if (isEmpty(dataDir)) {
      loader = new ClasspathResourceLoader(HenkanFactory.class);
      hasOptions = HenkanFactory.class.getResource(OPTIONS_FILE) != null;
    } else {
      Path dir = Paths.get(dataDir);
      loader = new FilesystemResourceLoader(dir, HenkanFactory.class.getClassLoader());
      hasOptions = Files.exists(dir.resolve(OPTIONS_FILE));
    }

    ConverterOptions options = ConverterOptions.DEFAULT;
    if (hasOptions) {
      InputStream in = null;
      try {
        in = loader.openResource(OPTIONS_FILE);
        options = ConverterOptions.load(in);
      } finally {
        IOUtils.closeWhileHandlingException(in);
      }
    }
    log.info("Loading conversion data from [{}] with {}", isEmpty(dataDir) ? "classpath" : dataDir, options);
    return load(loader, options);
  }

  /**
   * Loads the tables and the dictionary through a Lucene resource loader.
   *
   * @throws IOException if a resource is missing or malformed
   */
  public static HenkanFactory load(ResourceLoader loader, ConverterOptions options) throws IOException {
    long start = System.currentTimeMillis();
    Connector connector;
    Segmenter segmenter;
    FstDictionary dictionary;

    InputStream in = null;
    try {
      in = loader.openResource(CONNECTOR_FILE);
      connector = Connector.load(in);
    } finally {
      IOUtils.closeWhileHandlingException(in);
    }

    in = null;
    try {
      in = loader.openResource(SEGMENTER_FILE);
      segmenter = Segmenter.load(in);
    } finally {
      IOUtils.closeWhileHandlingException(in);
    }

    in = null;
    try {
      in = loader.openResource(DICTIONARY_FILE);
      dictionary = FstDictionary.build(new DictionaryFileReader().read(in, StandardCharsets.UTF_8).getEntries());
    } finally {
      IOUtils.closeWhileHandlingException(in);
    }

    log.info("Loaded {}x{} connector, {} segmenter ids and {} dictionary keys in {} ms",
        connector.getLeftSize(), connector.getRightSize(), segmenter.getIdSize(), dictionary.size(),
        System.currentTimeMillis() - start);
    return new HenkanFactory(connector, segmenter, dictionary, options);
  }

  private static boolean isEmpty(String dataDir) {
    return dataDir == null || dataDir.trim().length() == 0;
  }

  /**
   * The converter configured with this factory's options.
   */
  public ImmutableConverter getConverter() {
    return converter;
  }

  /**
   * A converter sharing this factory's tables under other options.
   */
  public ImmutableConverter getConverter(ConverterOptions options) {
    return new ImmutableConverter(connector, segmenter, dictionary, options);
  }

  public Connector getConnector() {
    return connector;
  }

  public Segmenter getSegmenter() {
    return segmenter;
  }

  public DictionaryLookup getDictionary() {
    return dictionary;
  }

  public ConverterOptions getOptions() {
    return options;
  }
}
