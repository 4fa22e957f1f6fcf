/*
   Copyright (c) 2015 LinkedIn Corp.

   Licensed under the Apache License, Version 2.0 (the "License");
   you may not use this file except in compliance with the License.
   You may obtain a copy of the License at

       http://www.apache.org/licenses/LICENSE-2.0

   Unless required by applicable law or agreed to in writing, software
   distributed under the License is distributed on an "AS IS" BASIS,
   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
   See the License for the specific language governing permissions and
   limitations under the License.
*/

package com.linkedin.formdata.writer;


import com.linkedin.data.ByteString;

import java.io.Closeable;
import java.io.IOException;


/**
 * Pull based supplier of the body of a single part. A source is read once, from the beginning to the end.
 *
 * @author Karim Vidhani
 */
public interface FormDataBodySource extends Closeable
{
  /**
   * Returns the next chunk of the body, or null once the body is complete. Empty chunks are allowed and skipped by
   * the encoder.
   *
   * @throws IOException if the underlying data could not be read.
   */
  ByteString nextChunk() throws IOException;

  /**
   * Total number of bytes this source produces, or -1 if it is not known up front.
   */
  long length();

  /**
   * Releases any resources held by this source. Called by the encoder once the source was fully read, failed, or
   * when the encoder itself is closed. Calling it more than once has no effect.
   */
  @Override
  void close();
}
