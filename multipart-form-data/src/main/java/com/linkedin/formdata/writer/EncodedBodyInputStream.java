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


import com.linkedin.formdata.exceptions.FormDataEncodingException;

import java.io.IOException;
import java.io.InputStream;


/**
 * Blocking {@link InputStream} view of a {@link MultiPartFormDataEncoder}, for callers that write bodies to streams.
 * A failure of a body source surfaces as the {@link IOException} that caused it.
 */
final class EncodedBodyInputStream extends InputStream
{
  private final MultiPartFormDataEncoder _encoder;
  private byte[] _current = new byte[0];
  private int _position = 0;

  EncodedBodyInputStream(final MultiPartFormDataEncoder encoder)
  {
    _encoder = encoder;
  }

  @Override
  public int read() throws IOException
  {
    if (!ensureAvailable())
    {
      return -1;
    }
    return _current[_position++] & 0xFF;
  }

  @Override
  public int read(final byte[] bytes, final int offset, final int length) throws IOException
  {
    if (offset < 0 || length < 0 || length > bytes.length - offset)
    {
      throw new IndexOutOfBoundsException();
    }
    if (length == 0)
    {
      return 0;
    }
    if (!ensureAvailable())
    {
      return -1;
    }
    final int count = Math.min(length, _current.length - _position);
    System.arraycopy(_current, _position, bytes, offset, count);
    _position += count;
    return count;
  }

  @Override
  public int available()
  {
    return _current.length - _position;
  }

  @Override
  public void close()
  {
    _encoder.close();
  }

  private boolean ensureAvailable() throws IOException
  {
    try
    {
      while (_position >= _current.length)
      {
        if (!_encoder.hasNext())
        {
          return false;
        }
        _current = _encoder.next().copyBytes();
        _position = 0;
      }
      return true;
    }
    catch (FormDataEncodingException encodingException)
    {
      if (encodingException.getCause() instanceof IOException)
      {
        throw (IOException) encodingException.getCause();
      }
      throw encodingException;
    }
  }
}
