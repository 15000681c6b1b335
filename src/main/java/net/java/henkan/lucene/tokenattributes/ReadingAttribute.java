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

import org.apache.lucene.util.Attribute;

/**
 * The kana reading a token was converted from, and the other values it could
 * have been converted to.
 */
public interface ReadingAttribute extends Attribute {
  public String getReading();

  public void setReading(String reading);

  /**
   * Candidate values of the token's segment, best first; the term itself is
   * the first one.
   */
  public String[] getCandidates();

  public void setCandidates(String[] candidates);
}
