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

import java.nio.charset.Charset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Describes one part to be written by {@link MultiPartFormDataEncoder}: a named text field or an uploaded file.
 *
 * Instances are immutable apart from the body source, which is consumed by the encoder. A part can therefore be
 * encoded only once.
 *
 * @author Karim Vidhani
 */
public final class FormDataPart
{
  private final String _name;
  private final String _filename;
  private final String _contentType;
  private final Map<String, String> _headers;
  private final FormDataBodySource _bodySource;

  private FormDataPart(final String name, final String filename, final String contentType,
      final Map<String, String> headers, final FormDataBodySource bodySource)
  {
    _name = name;
    _filename = filename;
    _contentType = contentType;
    _headers = Collections.unmodifiableMap(new LinkedHashMap<String, String>(headers));
    _bodySource = bodySource;
  }

  /**
   * A text field encoded as UTF-8, without a Content-Type header.
   */
  public static FormDataPart field(final String name, final String value)
  {
    return new Builder(name).withBody(value, MultiPartFormDataUtils.UTF_8).build();
  }

  /**
   * A file upload held in memory.
   */
  public static FormDataPart file(final String name, final String filename, final String contentType,
      final ByteString content)
  {
    return new Builder(name).withFilename(filename).withContentType(contentType).withBody(content).build();
  }

  public String getName()
  {
    return _name;
  }

  public String getFilename()
  {
    return _filename;
  }

  public String getContentType()
  {
    return _contentType;
  }

  /**
   * Extra headers, never including Content-Disposition or Content-Type.
   */
  public Map<String, String> getHeaders()
  {
    return _headers;
  }

  public FormDataBodySource getBodySource()
  {
    return _bodySource;
  }

  /**
   * All headers of this part in the order they are written, starting with Content-Disposition.
   */
  Map<String, String> getSerializableHeaders()
  {
    final StringBuilder disposition = new StringBuilder(MultiPartFormDataUtils.FORM_DATA_DISPOSITION);
    disposition.append("; ").append(MultiPartFormDataUtils.NAME_PARAMETER).append('=')
        .append(MultiPartFormDataUtils.quoteParameterValue(_name));
    if (_filename != null)
    {
      disposition.append("; ").append(MultiPartFormDataUtils.FILENAME_PARAMETER).append('=')
          .append(MultiPartFormDataUtils.quoteParameterValue(_filename));
    }

    final Map<String, String> headers = new LinkedHashMap<String, String>();
    headers.put(MultiPartFormDataUtils.CONTENT_DISPOSITION_HEADER, disposition.toString());
    if (_contentType != null)
    {
      headers.put(MultiPartFormDataUtils.CONTENT_TYPE_HEADER, _contentType);
    }
    headers.putAll(_headers);
    return headers;
  }

  @Override
  public String toString()
  {
    return "FormDataPart{name=" + _name + ", filename=" + _filename + ", contentType=" + _contentType + "}";
  }

  /**
   * Builder for {@link FormDataPart}. Line breaks in names, filenames or header values would corrupt the framing
   * of the body and are rejected with an {@link IllegalArgumentException}.
   */
  public static final class Builder
  {
    private final String _name;
    private String _filename;
    private String _contentType;
    private final Map<String, String> _headers = new LinkedHashMap<String, String>();
    private FormDataBodySource _bodySource;

    //The field name is required
    public Builder(final String name)
    {
      if (name == null)
      {
        throw new IllegalArgumentException("Null field name provided");
      }
      checkNoLineBreak("field name", name);
      _name = name;
    }

    public Builder withFilename(final String filename)
    {
      checkNoLineBreak("filename", filename);
      _filename = filename;
      return this;
    }

    public Builder withContentType(final String contentType)
    {
      checkNoLineBreak("Content-Type", contentType);
      _contentType = contentType;
      return this;
    }

    /**
     * Adds an extra header. Content-Disposition is always generated from the name and filename, and Content-Type
     * is taken from {@link #withContentType(String)}, so headers with those names are ignored.
     */
    public Builder withHeader(final String name, final String value)
    {
      if (name == null || name.trim().isEmpty() || name.indexOf(':') != -1)
      {
        throw new IllegalArgumentException("Invalid header name '" + name + "'");
      }
      checkNoLineBreak("header name", name);
      checkNoLineBreak("header value", value);
      if (name.equalsIgnoreCase(MultiPartFormDataUtils.CONTENT_DISPOSITION_HEADER)
          || name.equalsIgnoreCase(MultiPartFormDataUtils.CONTENT_TYPE_HEADER))
      {
        return this;
      }
      _headers.put(name, value == null ? "" : value);
      return this;
    }

    public Builder withHeaders(final Map<String, String> headers)
    {
      for (final Map.Entry<String, String> header : headers.entrySet())
      {
        withHeader(header.getKey(), header.getValue());
      }
      return this;
    }

    public Builder withBody(final FormDataBodySource bodySource)
    {
      if (bodySource == null)
      {
        throw new IllegalArgumentException("Null body source provided");
      }
      _bodySource = bodySource;
      return this;
    }

    public Builder withBody(final ByteString body)
    {
      return withBody(new ByteStringBodySource(body));
    }

    public Builder withBody(final String body, final Charset charset)
    {
      return withBody(ByteString.copyString(body, charset));
    }

    /**
     * Builds the part. A part without a body source has an empty body.
     */
    public FormDataPart build()
    {
      final FormDataBodySource bodySource =
          _bodySource == null ? new ByteStringBodySource(ByteString.empty()) : _bodySource;
      return new FormDataPart(_name, _filename, _contentType, _headers, bodySource);
    }

    private static void checkNoLineBreak(final String what, final String value)
    {
      if (MultiPartFormDataUtils.containsLineBreak(value))
      {
        throw new IllegalArgumentException("The " + what + " may not contain CR or LF characters");
      }
    }
  }
}
