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
import com.linkedin.formdata.MultiPartFormDataUtils;
import com.linkedin.formdata.exceptions.FormDataEncodingException;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.commons.lang.ArrayUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Used to aggregate multiple {@link FormDataPart}s and subsequently produce a multipart/form-data body.
 *
 * The body is produced lazily as a single pass sequence of chunks. Part bodies are pulled from their
 * {@link FormDataBodySource}s only as the caller iterates, so the encoder never holds more than one chunk in memory.
 * For every part the encoder yields the delimiter line and header block, then the part's body chunks. After the last
 * part it yields the terminal boundary. Empty chunks are never yielded.
 *
 * Note that NONE of the APIs in this class are thread safe.
 *
 * @author Karim Vidhani
 */
public final class MultiPartFormDataEncoder implements Iterator<ByteString>, Closeable
{
  private static final Logger log = LoggerFactory.getLogger(MultiPartFormDataEncoder.class);

  private enum Stage
  {
    PREAMBLE,
    NEXT_PART,
    PART_BODY,
    EPILOGUE,
    EXHAUSTED
  }

  private final String _rawBoundary;
  private final ByteString _preamble;
  private final List<ByteString> _serializedBoundariesAndHeaders;
  private final List<FormDataBodySource> _bodySources;
  private final ByteString _finalBoundary;
  private final ByteString _epilogue;

  private Stage _stage = Stage.PREAMBLE;
  private int _partIndex = 0;
  private FormDataBodySource _currentSource;
  private ByteString _next;

  /**
   * Builder to create the MultiPartFormDataEncoder.
   */
  public static class Builder
  {
    private final String _rawBoundary;
    //As per the RFC there must be CRLF and two preceding hyphen characters on each boundary between each parts
    private final byte[] _normalEncapsulationBoundary;
    private final List<ByteString> _serializedBoundariesAndHeaders = new ArrayList<ByteString>();
    private final List<FormDataBodySource> _bodySources = new ArrayList<FormDataBodySource>();
    private String _preamble = "";
    private String _epilogue = "";

    /**
     * Create a builder that writes parts separated by the given boundary.
     *
     * @param boundary the boundary, between 1 and 70 characters.
     */
    public Builder(final String boundary)
    {
      if (boundary == null || boundary.isEmpty() || boundary.length() > MultiPartFormDataUtils.MAXIMUM_BOUNDARY_LENGTH)
      {
        throw new IllegalArgumentException("The boundary must be between 1 and "
            + MultiPartFormDataUtils.MAXIMUM_BOUNDARY_LENGTH + " characters");
      }
      if (MultiPartFormDataUtils.containsLineBreak(boundary))
      {
        throw new IllegalArgumentException("The boundary may not contain CR or LF characters");
      }
      _rawBoundary = boundary;
      _normalEncapsulationBoundary = ArrayUtils.addAll(MultiPartFormDataUtils.CRLF_BYTES,
          ArrayUtils.addAll(MultiPartFormDataUtils.DOUBLE_HYPHEN_BYTES, boundary.getBytes(MultiPartFormDataUtils.ASCII)));
    }

    /**
     * Create a builder using a randomly generated boundary.
     */
    public Builder()
    {
      this(MultiPartFormDataUtils.generateBoundary());
    }

    /**
     * Text to be placed before the first part. Readers ignore it.
     */
    public Builder withPreamble(final String preamble)
    {
      _preamble = preamble == null ? "" : preamble;
      return this;
    }

    /**
     * Text to be placed after the terminal boundary. Readers ignore it.
     */
    public Builder withEpilogue(final String epilogue)
    {
      _epilogue = epilogue == null ? "" : epilogue;
      return this;
    }

    /**
     * Append a {@link FormDataPart} to be placed in the body.
     */
    public Builder appendPart(final FormDataPart part)
    {
      if (part == null)
      {
        throw new IllegalArgumentException("Null part provided");
      }
      _serializedBoundariesAndHeaders.add(
          MultiPartFormDataUtils.serializeBoundaryAndHeaders(_normalEncapsulationBoundary, part.getSerializableHeaders()));
      _bodySources.add(part.getBodySource());
      return this;
    }

    /**
     * Append multiple {@link FormDataPart}s, keeping their order.
     */
    public Builder appendParts(final List<FormDataPart> parts)
    {
      for (final FormDataPart part : parts)
      {
        appendPart(part);
      }
      return this;
    }

    public MultiPartFormDataEncoder build()
    {
      //As per the RFC the final boundary has two extra hyphens at the end
      final byte[] finalEncapsulationBoundary = ArrayUtils.addAll(
          ArrayUtils.addAll(_normalEncapsulationBoundary, MultiPartFormDataUtils.DOUBLE_HYPHEN_BYTES),
          MultiPartFormDataUtils.CRLF_BYTES);
      return new MultiPartFormDataEncoder(_rawBoundary, ByteString.copyString(_preamble, MultiPartFormDataUtils.ASCII),
          _serializedBoundariesAndHeaders, _bodySources, ByteString.copy(finalEncapsulationBoundary),
          ByteString.copyString(_epilogue, MultiPartFormDataUtils.ASCII));
    }
  }

  /**
   * Shorthand for {@code new Builder(boundary).appendParts(parts).build()}.
   */
  public static MultiPartFormDataEncoder encode(final String boundary, final List<FormDataPart> parts)
  {
    return new Builder(boundary).appendParts(parts).build();
  }

  private MultiPartFormDataEncoder(final String rawBoundary, final ByteString preamble,
      final List<ByteString> serializedBoundariesAndHeaders, final List<FormDataBodySource> bodySources,
      final ByteString finalBoundary, final ByteString epilogue)
  {
    _rawBoundary = rawBoundary;
    _preamble = preamble;
    _serializedBoundariesAndHeaders = Collections.unmodifiableList(new ArrayList<ByteString>(serializedBoundariesAndHeaders));
    _bodySources = Collections.unmodifiableList(new ArrayList<FormDataBodySource>(bodySources));
    _finalBoundary = finalBoundary;
    _epilogue = epilogue;
  }

  public String getBoundary()
  {
    return _rawBoundary;
  }

  /**
   * The value of the Content-Type header to send along with this body.
   */
  public String getContentTypeHeader()
  {
    return MultiPartFormDataUtils.buildContentTypeHeader(_rawBoundary);
  }

  /**
   * Total number of bytes this encoder produces, or -1 if a body source does not know its length.
   */
  public long getContentLength()
  {
    long total = _preamble.length() + _finalBoundary.length() + _epilogue.length();
    for (int i = 0; i < _bodySources.size(); i++)
    {
      final long length = _bodySources.get(i).length();
      if (length < 0)
      {
        return -1;
      }
      total += _serializedBoundariesAndHeaders.get(i).length() + length;
    }
    return total;
  }

  @Override
  public boolean hasNext()
  {
    if (_next == null && _stage != Stage.EXHAUSTED)
    {
      _next = computeNext();
    }
    return _next != null;
  }

  @Override
  public ByteString next()
  {
    if (!hasNext())
    {
      throw new NoSuchElementException("The multipart/form-data body was already fully produced");
    }
    final ByteString result = _next;
    _next = null;
    return result;
  }

  @Override
  public void remove()
  {
    throw new UnsupportedOperationException("remove");
  }

  /**
   * Adapts this encoder to an {@link InputStream}. The stream and this encoder share their position.
   */
  public InputStream asInputStream()
  {
    return new EncodedBodyInputStream(this);
  }

  /**
   * Stops encoding and closes every body source that was not fully read.
   */
  @Override
  public void close()
  {
    if (_stage == Stage.EXHAUSTED)
    {
      return;
    }
    closeRemainingSources();
    _stage = Stage.EXHAUSTED;
    _next = null;
  }

  //Returns the next non-empty chunk, or null once everything was produced.
  private ByteString computeNext()
  {
    while (true)
    {
      switch (_stage)
      {
        case PREAMBLE:
          _stage = Stage.NEXT_PART;
          if (!_preamble.isEmpty())
          {
            return _preamble;
          }
          break;
        case NEXT_PART:
          if (_partIndex < _bodySources.size())
          {
            _currentSource = _bodySources.get(_partIndex);
            final ByteString boundaryAndHeaders = _serializedBoundariesAndHeaders.get(_partIndex);
            _partIndex++;
            _stage = Stage.PART_BODY;
            return boundaryAndHeaders;
          }
          _stage = Stage.EPILOGUE;
          log.debug("Wrote {} parts, writing the final boundary", _partIndex);
          return _finalBoundary;
        case PART_BODY:
        {
          final ByteString chunk = readCurrentSource();
          if (chunk == null)
          {
            _currentSource.close();
            _currentSource = null;
            _stage = Stage.NEXT_PART;
          }
          else if (!chunk.isEmpty())
          {
            return chunk;
          }
          break;
        }
        case EPILOGUE:
          _stage = Stage.EXHAUSTED;
          if (!_epilogue.isEmpty())
          {
            return _epilogue;
          }
          break;
        default:
          return null;
      }
    }
  }

  private ByteString readCurrentSource()
  {
    try
    {
      return _currentSource.nextChunk();
    }
    catch (IOException ioException)
    {
      log.warn("Reading the body of part {} failed, aborting the multipart/form-data body", _partIndex);
      close();
      throw new FormDataEncodingException("Failed to read the body of part " + _partIndex, ioException);
    }
  }

  private void closeRemainingSources()
  {
    if (_currentSource != null)
    {
      _currentSource.close();
      _currentSource = null;
    }
    for (int i = _partIndex; i < _bodySources.size(); i++)
    {
      _bodySources.get(i).close();
    }
    _partIndex = _bodySources.size();
  }
}
