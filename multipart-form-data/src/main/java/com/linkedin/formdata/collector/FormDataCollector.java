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

package com.linkedin.formdata.collector;


import com.linkedin.data.ByteString;
import com.linkedin.formdata.DecodeEvent;
import com.linkedin.formdata.DecodeEventHandler;
import com.linkedin.formdata.MultiPartFormDataDecoder;
import com.linkedin.formdata.MultiPartFormDataUtils;
import com.linkedin.formdata.ParameterizedHeader;
import com.linkedin.formdata.exceptions.BodyTooLargeException;
import com.linkedin.formdata.exceptions.StateViolationException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A {@link DecodeEventHandler} that materializes every part in memory. Text fields become Strings, decoded with the
 * charset parameter of the part's Content-Type header or the collector's default charset. Parts with a filename become
 * {@link FormDataFile}s.
 *
 * Pass the collector to {@link MultiPartFormDataDecoder#feed(ByteString, DecodeEventHandler)} for every chunk and call
 * {@link #getFormData()} once the decoder finished. Parts larger than the configured limits fail the decoder with a
 * {@link BodyTooLargeException}.
 */
public final class FormDataCollector implements DecodeEventHandler
{
  private static final Logger log = LoggerFactory.getLogger(FormDataCollector.class);

  public static final int DEFAULT_MAXIMUM_FIELD_SIZE = 1024 * 1024;
  public static final long DEFAULT_MAXIMUM_FILE_SIZE = -1;

  private final Charset _defaultCharset;
  private final int _maximumFieldSize;
  private final long _maximumFileSize;

  private final List<FormDataField> _fields = new ArrayList<FormDataField>();
  private final List<FormDataFile> _files = new ArrayList<FormDataFile>();
  private final ByteArrayOutputStream _currentBody = new ByteArrayOutputStream();
  private DecodeEvent.PartStarted _currentPart;

  public FormDataCollector()
  {
    this(MultiPartFormDataUtils.UTF_8, DEFAULT_MAXIMUM_FIELD_SIZE, DEFAULT_MAXIMUM_FILE_SIZE);
  }

  private FormDataCollector(final Charset defaultCharset, final int maximumFieldSize, final long maximumFileSize)
  {
    _defaultCharset = defaultCharset;
    _maximumFieldSize = maximumFieldSize;
    _maximumFileSize = maximumFileSize;
  }

  /**
   * Decodes a complete body held in memory.
   *
   * @param boundary the boundary parameter of the request's Content-Type header.
   * @param body the complete body.
   */
  public static FormData collect(final String boundary, final ByteString body)
  {
    final FormDataCollector collector = new FormDataCollector();
    final MultiPartFormDataDecoder decoder = new MultiPartFormDataDecoder(boundary);
    decoder.feed(body, collector);
    decoder.finish();
    return collector.getFormData();
  }

  @Override
  public void onPartStarted(final DecodeEvent.PartStarted partStarted)
  {
    if (_currentPart != null)
    {
      throw new StateViolationException("Part '" + partStarted.getName() + "' started before part '"
          + _currentPart.getName() + "' ended");
    }
    _currentPart = partStarted;
    _currentBody.reset();
  }

  @Override
  public void onBodyChunk(final DecodeEvent.BodyChunk bodyChunk)
  {
    if (_currentPart == null)
    {
      throw new StateViolationException("Received body data outside of a part");
    }

    final long limit = _currentPart.isFile() ? _maximumFileSize : _maximumFieldSize;
    final long newSize = (long) _currentBody.size() + bodyChunk.getData().length();
    if (limit >= 0 && newSize > limit)
    {
      throw new BodyTooLargeException((_currentPart.isFile() ? "File '" : "Field '") + _currentPart.getName()
          + "' exceeds the maximum size of " + limit + " bytes.");
    }

    final byte[] bytes = bodyChunk.getData().copyBytes();
    _currentBody.write(bytes, 0, bytes.length);
  }

  @Override
  public void onPartEnded(final DecodeEvent.PartEnded partEnded)
  {
    if (_currentPart == null)
    {
      throw new StateViolationException("Received the end of a part that never started");
    }

    final byte[] body = _currentBody.toByteArray();
    if (_currentPart.isFile())
    {
      _files.add(new FormDataFile(_currentPart.getName(), _currentPart.getFilename(), _currentPart.getHeaders(),
          ByteString.copy(body)));
    }
    else
    {
      _fields.add(new FormDataField(_currentPart.getName(), new String(body, charsetOf(_currentPart)),
          _currentPart.getHeaders()));
    }
    _currentPart = null;
    _currentBody.reset();
  }

  /**
   * The parts completed so far.
   */
  public FormData getFormData()
  {
    return new FormData(_fields, _files);
  }

  private Charset charsetOf(final DecodeEvent.PartStarted part)
  {
    final String contentType = part.getContentType();
    if (contentType == null)
    {
      return _defaultCharset;
    }

    final String charsetName = ParameterizedHeader.parse(contentType).getParameter(MultiPartFormDataUtils.CHARSET_PARAMETER);
    if (charsetName == null || charsetName.isEmpty())
    {
      return _defaultCharset;
    }
    try
    {
      if (Charset.isSupported(charsetName))
      {
        return Charset.forName(charsetName);
      }
    }
    catch (IllegalCharsetNameException e)
    {
      log.debug("Illegal charset name '{}' for field '{}'", charsetName, part.getName());
    }
    log.debug("Unsupported charset '{}' for field '{}', using {}", charsetName, part.getName(), _defaultCharset);
    return _defaultCharset;
  }

  /**
   * Builder for collectors with non-default limits.
   */
  public static final class Builder
  {
    private Charset _defaultCharset = MultiPartFormDataUtils.UTF_8;
    private int _maximumFieldSize = DEFAULT_MAXIMUM_FIELD_SIZE;
    private long _maximumFileSize = DEFAULT_MAXIMUM_FILE_SIZE;

    public Builder withDefaultCharset(final Charset defaultCharset)
    {
      _defaultCharset = defaultCharset;
      return this;
    }

    /**
     * Limits the size of each text field. A negative value means no limit.
     */
    public Builder withMaximumFieldSize(final int maximumFieldSize)
    {
      _maximumFieldSize = maximumFieldSize;
      return this;
    }

    /**
     * Limits the size of each file. A negative value, the default, means no limit.
     */
    public Builder withMaximumFileSize(final long maximumFileSize)
    {
      _maximumFileSize = maximumFileSize;
      return this;
    }

    public FormDataCollector build()
    {
      return new FormDataCollector(_defaultCharset, _maximumFieldSize, _maximumFileSize);
    }
  }
}
