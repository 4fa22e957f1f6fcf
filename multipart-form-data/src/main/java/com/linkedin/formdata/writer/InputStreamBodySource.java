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

import java.io.IOException;
import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A body read from a caller supplied {@link InputStream}, one chunk per {@link #nextChunk()}.
 *
 * This class closes the underlying input stream when either of the following happen:
 * <ul>
 *   <li>The stream is finished being read.</li>
 *   <li>There was an exception reading the stream.</li>
 *   <li>The source was closed before it was finished, for example because the encoder was closed.</li>
 * </ul>
 *
 * @author Karim Vidhani
 */
public final class InputStreamBodySource implements FormDataBodySource
{
  private static final Logger log = LoggerFactory.getLogger(InputStreamBodySource.class);

  public static final int DEFAULT_WRITE_CHUNK_SIZE = 5000;

  private final InputStream _inputStream;
  private final int _writeChunkSize;
  private final long _length;
  //There is no way to see if an InputStream has already been closed.
  private boolean _dataSourceFinished = false;

  @Override
  public ByteString nextChunk() throws IOException
  {
    if (_dataSourceFinished)
    {
      return null;
    }

    final byte[] bytes = new byte[_writeChunkSize];
    final int bytesRead;
    try
    {
      bytesRead = _inputStream.read(bytes);
    }
    catch (IOException ioException)
    {
      close();
      throw ioException;
    }

    //The number of bytes 'N' here could be the following:
    if (bytesRead == -1)
    {
      //1. N==-1. This signifies the stream is complete in the case that we coincidentally read to completion on the
      //last read from the InputStream.
      close();
      return null;
    }
    else if (bytesRead == _writeChunkSize)
    {
      //2. N==Capacity. This signifies the most common case which is that we read as many bytes as we originally desired.
      return ByteString.copy(bytes);
    }
    else
    {
      //3. Capacity > N >= 0. A short read. Streams may return fewer bytes than requested before they end, so we
      //keep reading until -1.
      return ByteString.copy(bytes, 0, bytesRead);
    }
  }

  @Override
  public long length()
  {
    return _length;
  }

  @Override
  public void close()
  {
    if (_dataSourceFinished)
    {
      return;
    }
    _dataSourceFinished = true;
    try
    {
      _inputStream.close();
    }
    catch (IOException ioException)
    {
      //An exception thrown when we try to close the InputStream should not make its way down as an error.
      log.debug("Ignoring failure to close a body input stream", ioException);
    }
  }

  /**
   * Create a new instance of an InputStreamBodySource that wraps the provided InputStream.
   */
  public static class Builder
  {
    private final InputStream _inputStream;
    private int _writeChunkSize = DEFAULT_WRITE_CHUNK_SIZE;
    private long _length = -1;

    //This is required
    public Builder(final InputStream inputStream)
    {
      if (inputStream == null)
      {
        throw new IllegalArgumentException("Null InputStream provided");
      }
      _inputStream = inputStream;
    }

    public Builder withWriteChunkSize(final int writeChunkSize)
    {
      if (writeChunkSize <= 0)
      {
        throw new IllegalArgumentException("The write chunk size must be positive");
      }
      _writeChunkSize = writeChunkSize;
      return this;
    }

    /**
     * Declares the number of bytes the stream holds, which allows the encoder to compute a content length.
     */
    public Builder withLength(final long length)
    {
      _length = length;
      return this;
    }

    public InputStreamBodySource build()
    {
      return new InputStreamBodySource(_inputStream, _writeChunkSize, _length);
    }
  }

  //Private construction due to the builder
  private InputStreamBodySource(final InputStream inputStream, final int writeChunkSize, final long length)
  {
    _inputStream = inputStream;
    _writeChunkSize = writeChunkSize;
    _length = length;
  }
}
