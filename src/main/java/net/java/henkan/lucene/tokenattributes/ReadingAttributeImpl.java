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

package net.java.henkan.lucene.tokenattributes;

import java.util.Arrays;

import org.apache.lucene.util.AttributeImpl;
import org.apache.lucene.util.AttributeReflector;

/**
 * Attribute for the reading and candidates of a converted segment.
 */
public class ReadingAttributeImpl extends AttributeImpl implements ReadingAttribute, Cloneable {
  private static final String[] NO_CANDIDATES = new String[0];

  private String reading = null;
  private String[] candidates = NO_CANDIDATES;

  public String getReading() {
    return reading;
  }

  public void setReading(String reading) {
    this.reading = reading;
  }

  public String[] getCandidates() {
    return candidates;
  }

  public void setCandidates(String[] candidates) {
    this.candidates = candidates == null ? NO_CANDIDATES : candidates;
  }

  @Override
  public void clear() {
    reading = null;
    candidates = NO_CANDIDATES;
  }

  @Override
  public void copyTo(AttributeImpl target) {
    ReadingAttribute t = (ReadingAttribute) target;
    t.setReading(reading);
    t.setCandidates(candidates);
  }

  @Override
  public void reflectWith(AttributeReflector reflector) {
    reflector.reflect(ReadingAttribute.class, "reading", reading);
    reflector.reflect(ReadingAttribute.class, "candidates", Arrays.toString(candidates));
  }
}
