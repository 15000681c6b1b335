/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.java.henkan.lucene;

import java.io.IOException;
import java.util.Map;

import net.java.henkan.ConverterOptions;
import net.java.henkan.HenkanFactory;
import net.java.henkan.converter.ImmutableConverter;

import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.util.ResourceLoader;
import org.apache.lucene.analysis.util.ResourceLoaderAware;
import org.apache.lucene.analysis.util.TokenizerFactory;
import org.apache.lucene.util.AttributeFactory;

/**
 * Factory for {@link HenkanTokenizer}.
 * <pre class="prettyprint">
 * &lt;fieldType name="text_henkan" class="solr.TextField"&gt;
 *   &lt;analyzer&gt;
 *     &lt;tokenizer class="net.java.henkan.lucene.HenkanTokenizerFactory"
 *       dataDir="henkan" maxCandidates="10" keyCorrection="true"/&gt;
 *   &lt;/analyzer&gt;
 * &lt;/fieldType&gt;</pre>
 * Without {@code dataDir} the tables and the dictionary are opened through
 * the resource loader.
 */
public class HenkanTokenizerFactory extends TokenizerFactory implements ResourceLoaderAware {

  /** SPI name */
  public static final String NAME = "henkan";

  private final String dataDir;
  private final String maxCandidates;
  private final String keyCorrection;
  private ImmutableConverter converter;

  public HenkanTokenizerFactory(Map<String, String> args) {
    super(args);
    dataDir = get(args, "dataDir");
    maxCandidates = get(args, "maxCandidates");
    keyCorrection = get(args, "keyCorrection");
    if (!args.isEmpty()) {
      throw new IllegalArgumentException("Unknown parameters: " + args);
    }
  }

  @Override
  public void inform(ResourceLoader loader) throws IOException {
    if (dataDir != null) {
      HenkanFactory factory = HenkanFactory.getInstance(dataDir);
      converter = factory.getConverter(applyArgs(factory.getOptions()));
    } else {
      converter = HenkanFactory.load(loader, applyArgs(ConverterOptions.DEFAULT)).getConverter();
    }
  }

  private ConverterOptions applyArgs(ConverterOptions options) {
    ConverterOptions.Builder builder = options.toBuilder();
    if (maxCandidates != null) {
      builder.maxCandidates(Integer.parseInt(maxCandidates));
    }
    if (keyCorrection != null) {
      builder.keyCorrection(Boolean.parseBoolean(keyCorrection));
    }
    return builder.build();
  }

  @Override
  public Tokenizer create(AttributeFactory factory) {
    if (converter == null) {
      throw new IllegalStateException("inform() must be called before create()");
    }
    return new HenkanTokenizer(factory, converter);
  }
}
