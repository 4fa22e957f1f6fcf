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

package com.linkedin.formdata;


import com.linkedin.formdata.exceptions.MalformedHeaderException;
import com.linkedin.formdata.exceptions.MissingFieldNameException;

import java.nio.charset.Charset;


/**
 * Parses the header block of a single part, meaning every byte between the boundary line and the blank line.
 *
 * @author Karim Vidhani
 */
class PartHeaderParser
{
  private final Charset _charset;

  PartHeaderParser(final Charset charset)
  {
    _charset = charset;
  }

  Charset getCharset()
  {
    return _charset;
  }

  /**
   * @param headerBlock the raw header lines without the terminating blank line. May be empty.
   * @return the parsed headers.
   * @throws MalformedHeaderException if a line has no colon or an empty name, or if the block starts with a
   *                                  continuation line.
   */
  PartHeaders parse(final byte[] headerBlock)
  {
    if (headerBlock.length == 0)
    {
      return PartHeaders.empty();
    }

    final String block = new String(headerBlock, _charset);
    final String[] lines = block.split(MultiPartFormDataUtils.CRLF_STRING, -1);

    final PartHeaders.Builder builder = new PartHeaders.Builder();

    //Header folding is described in RFC 822 which states that headers may take up multiple lines. A line that starts
    //with a space or a tab continues the header above it. This syntax is deprecated, so we only support the common
    //case and join the pieces with a single space.
    String currentName = null;
    StringBuilder currentValue = null;
    for (final String line : lines)
    {
      if (line.isEmpty())
      {
        continue;
      }

      final char first = line.charAt(0);
      if (first == ' ' || first == '\t')
      {
        if (currentName == null)
        {
          throw new MalformedHeaderException("Malformed multipart/form-data request. A header block may not begin "
              + "with a continuation line.");
        }
        final String continuation = line.trim();
        if (!continuation.isEmpty())
        {
          if (currentValue.length() != 0)
          {
            currentValue.append(' ');
          }
          currentValue.append(continuation);
        }
        continue;
      }

      if (currentName != null)
      {
        builder.addHeader(currentName, currentValue.toString());
      }

      //Header values may contain colons but header names may not, so the first colon separates the two.
      final int colonIndex = line.indexOf(':');
      if (colonIndex == -1)
      {
        throw new MalformedHeaderException("Malformed multipart/form-data request. Individual headers are improperly "
            + "formatted: '" + line + "'.");
      }
      currentName = line.substring(0, colonIndex).trim();
      if (currentName.isEmpty())
      {
        throw new MalformedHeaderException("Malformed multipart/form-data request. Found a header with an empty name.");
      }
      currentValue = new StringBuilder(line.substring(colonIndex + 1).trim());
    }

    if (currentName != null)
    {
      builder.addHeader(currentName, currentValue.toString());
    }

    return builder.build();
  }

  /**
   * Parses the Content-Disposition header of a form-data part.
   *
   * @return the disposition, which is guaranteed to carry a name parameter.
   * @throws MissingFieldNameException if the header is absent or has no name.
   */
  ParameterizedHeader parseContentDisposition(final PartHeaders headers)
  {
    final String value = headers.get(MultiPartFormDataUtils.CONTENT_DISPOSITION_HEADER);
    if (value == null)
    {
      throw new MissingFieldNameException("Malformed multipart/form-data request. Part is missing the "
          + "Content-Disposition header.");
    }

    final ParameterizedHeader disposition = ParameterizedHeader.parse(value);
    if (disposition.getParameter(MultiPartFormDataUtils.NAME_PARAMETER) == null)
    {
      throw new MissingFieldNameException("Malformed multipart/form-data request. The Content-Disposition header '"
          + value + "' has no name parameter.");
    }
    return disposition;
  }
}
