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


/**
 * A body held in memory as a single {@link ByteString}.
 */
public final class ByteStringBodySource implements FormDataBodySource
{
  private final ByteString _data;
  private boolean _consumed = false;

  public ByteStringBodySource(final ByteString data)
  {
    if (data == null)
    {
      throw new IllegalArgumentException("Null ByteString provided");
    }
    _data = data;
  }

  @Override
  public ByteString nextChunk()
  {
    if (_consumed)
    {
      return null;
    }
    _consumed = true;
    return _data;
  }

  @Override
  public long length()
  {
    return _data.length();
  }

  @Override
  public void close()
  {
    _consumed = true;
  }
}
