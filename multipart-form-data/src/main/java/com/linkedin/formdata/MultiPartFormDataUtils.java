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


import com.linkedin.data.ByteString;
import com.linkedin.formdata.exceptions.BoundaryTooLongException;
import com.linkedin.formdata.exceptions.EmptyBoundaryException;
import com.linkedin.formdata.exceptions.IllegalFormDataFormatException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.security.SecureRandom;
import java.util.Locale;
import java.util.Map;
import java.util.Random;


/**
 * Constants and helpers shared by the multipart/form-data decoder and encoder.
 */
public final class MultiPartFormDataUtils
{
  public static final String CONTENT_TYPE_HEADER = "Content-Type";
  public static final String CONTENT_DISPOSITION_HEADER = "Content-Disposition";
  public static final String MULTIPART_FORM_DATA = "multipart/form-data";
  public static final String MULTIPART_PREFIX = "multipart/";
  public static final String FORM_DATA_DISPOSITION = "form-data";

  public static final String BOUNDARY_PARAMETER = "boundary";
  public static final String NAME_PARAMETER = "name";
  public static final String FILENAME_PARAMETER = "filename";
  public static final String CHARSET_PARAMETER = "charset";

  //RFC 2046 limits boundaries to 70 characters.
  public static final int MAXIMUM_BOUNDARY_LENGTH = 70;

  //Linear white space allowed between a boundary and its CRLF. Anything longer is treated as body data.
  public static final int MAXIMUM_TRANSPORT_PADDING = 64;

  public static final Charset ASCII = Charset.forName("US-ASCII");
  public static final Charset UTF_8 = Charset.forName("UTF-8");

  public static final byte CR_BYTE = 13;
  public static final byte LF_BYTE = 10;
  public static final byte SPACE_BYTE = 32;
  public static final byte TAB_BYTE = 9;
  public static final byte HYPHEN_BYTE = 45;

  public static final String CRLF_STRING = "\r\n";
  public static final byte[] CRLF_BYTES = CRLF_STRING.getBytes(ASCII);
  public static final byte[] CONSECUTIVE_CRLFS_BYTES = "\r\n\r\n".getBytes(ASCII);
  public static final byte[] DOUBLE_HYPHEN_BYTES = "--".getBytes(ASCII);

  private static final char[] MULTIPART_CHARS =
      "-_1234567890abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();

  private static final Random RANDOM = new SecureRandom();

  private MultiPartFormDataUtils()
  {
  }

  static boolean isTransportPadding(final byte b)
  {
    return b == SPACE_BYTE || b == TAB_BYTE;
  }

  /**
   * Verifies that the boundary is usable on the wire and returns it unchanged.
   *
   * @throws EmptyBoundaryException if the boundary has no bytes.
   * @throws BoundaryTooLongException if the boundary is longer than {@link #MAXIMUM_BOUNDARY_LENGTH}.
   */
  public static byte[] validateBoundary(final byte[] boundary)
  {
    if (boundary == null || boundary.length == 0)
    {
      throw new EmptyBoundaryException("The multipart boundary must not be empty.");
    }
    if (boundary.length > MAXIMUM_BOUNDARY_LENGTH)
    {
      throw new BoundaryTooLongException("The multipart boundary is " + boundary.length
          + " bytes long, the maximum is " + MAXIMUM_BOUNDARY_LENGTH + ".");
    }
    return boundary;
  }

  /**
   * Random boundary of 50 to 60 characters taken from the RFC 2046 safe alphabet.
   */
  public static String generateBoundary()
  {
    final StringBuilder buffer = new StringBuilder();
    //Between 50 and 60 characters, under the RFC limit of 70.
    final int count = RANDOM.nextInt(11) + 50;
    for (int i = 0; i < count; i++)
    {
      buffer.append(MULTIPART_CHARS[RANDOM.nextInt(MULTIPART_CHARS.length)]);
    }
    return buffer.toString();
  }

  /**
   * Builds the Content-Type header value announcing a multipart/form-data body with the given boundary.
   */
  public static String buildContentTypeHeader(final String boundary)
  {
    return MULTIPART_FORM_DATA + "; " + BOUNDARY_PARAMETER + "=" + quoteParameterValueIfNeeded(boundary);
  }

  /**
   * Extracts the boundary parameter from a Content-Type header value such as
   * {@code multipart/form-data; boundary="abc"}.
   *
   * @param contentTypeHeader the raw header value.
   * @return the unquoted boundary.
   * @throws IllegalFormDataFormatException if the value is not a multipart type or carries no usable boundary.
   */
  public static String extractBoundary(final String contentTypeHeader)
  {
    if (contentTypeHeader == null)
    {
      throw new IllegalFormDataFormatException("No Content-Type header provided.");
    }

    final ParameterizedHeader contentType = ParameterizedHeader.parse(contentTypeHeader);
    if (!contentType.getToken().toLowerCase(Locale.ROOT).startsWith(MULTIPART_PREFIX))
    {
      throw new IllegalFormDataFormatException("Improperly formatted Content-Type header. Expected a multipart type but "
          + "found '" + contentType.getToken() + "'.");
    }

    final String boundary = contentType.getParameter(BOUNDARY_PARAMETER);
    if (boundary == null)
    {
      throw new IllegalFormDataFormatException("No boundary parameter found!");
    }
    if (boundary.isEmpty() || boundary.length() > MAXIMUM_BOUNDARY_LENGTH)
    {
      throw new IllegalFormDataFormatException("Invalid boundary length " + boundary.length() + ".");
    }
    return boundary;
  }

  /**
   * Quotes a parameter value for use inside a header, escaping {@code "} and {@code \} with a backslash.
   */
  public static String quoteParameterValue(final String value)
  {
    final StringBuilder builder = new StringBuilder(value.length() + 2);
    builder.append('"');
    for (int i = 0; i < value.length(); i++)
    {
      final char c = value.charAt(i);
      if (c == '"' || c == '\\')
      {
        builder.append('\\');
      }
      builder.append(c);
    }
    builder.append('"');
    return builder.toString();
  }

  static String quoteParameterValueIfNeeded(final String value)
  {
    for (int i = 0; i < value.length(); i++)
    {
      final char c = value.charAt(i);
      //RFC 2045 tspecials plus white space
      if (c <= ' ' || "()<>@,;:\\\"/[]?=".indexOf(c) != -1)
      {
        return quoteParameterValue(value);
      }
    }
    return value;
  }

  public static String formattedHeader(final String name, final String value)
  {
    return (name == null ? "" : name) + ": " + (value == null ? "" : value) + CRLF_STRING;
  }

  /**
   * Serializes the delimiter line that opens a part, followed by the part's header block and the blank line that
   * ends it.
   *
   * @param delimiterBytes CRLF, two hyphens and the boundary.
   * @param headers the headers in the order they should be written.
   */
  public static ByteString serializeBoundaryAndHeaders(final byte[] delimiterBytes, final Map<String, String> headers)
  {
    final ByteArrayOutputStream byteArrayOutputStream = new ByteArrayOutputStream();
    byteArrayOutputStream.write(delimiterBytes, 0, delimiterBytes.length);
    byteArrayOutputStream.write(CRLF_BYTES, 0, CRLF_BYTES.length);

    final StringBuilder headerBuffer = new StringBuilder();
    for (final Map.Entry<String, String> header : headers.entrySet())
    {
      headerBuffer.append(formattedHeader(header.getKey(), header.getValue()));
    }
    //Browsers send non ASCII field names and filenames as raw UTF-8, so we do the same.
    final byte[] headerBytes = headerBuffer.toString().getBytes(UTF_8);
    byteArrayOutputStream.write(headerBytes, 0, headerBytes.length);
    byteArrayOutputStream.write(CRLF_BYTES, 0, CRLF_BYTES.length);

    return ByteString.copy(byteArrayOutputStream.toByteArray());
  }

  /**
   * Returns true if the string contains a CR or LF, which would break the framing of a header block.
   */
  public static boolean containsLineBreak(final String value)
  {
    return value != null && (value.indexOf('\r') != -1 || value.indexOf('\n') != -1);
  }
}
