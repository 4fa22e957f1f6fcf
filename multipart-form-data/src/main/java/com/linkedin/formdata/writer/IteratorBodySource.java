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

import java.util.Iterator;


/**
 * A body produced lazily by an {@link Iterator}. Null elements are not allowed.
 */
public final class IteratorBodySource implements FormDataBodySource
{
  private final Iterator<ByteString> _iterator;
  private final long _length;
  private boolean _closed = false;

  public IteratorBodySource(final Iterator<ByteString> iterator)
  {
    this(iterator, -1);
  }

  /**
   * @param length the total number of bytes the iterator yields, if the caller knows it up front.
   */
  public IteratorBodySource(final Iterator<ByteString> iterator, final long length)
  {
    if (iterator == null)
    {
      throw new IllegalArgumentException("Null iterator provided");
    }
    _iterator = iterator;
    _length = length;
  }

  @Override
  public ByteString nextChunk()
  {
    if (_closed || !_iterator.hasNext())
    {
      return null;
    }
    final ByteString chunk = _iterator.next();
    if (chunk == null)
    {
      throw new IllegalStateException("Iterator body sources may not yield null chunks");
    }
    return chunk;
  }

  @Override
  public long length()
  {
    return _length;
  }

  @Override
  public void close()
  {
    _closed = true;
  }
}
