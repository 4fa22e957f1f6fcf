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


import org.apache.commons.lang.ArrayUtils;


/**
 * Locates multipart delimiters inside a {@link ByteStringBuffer}.
 *
 * A delimiter is CRLF followed by "--" and the boundary. The first delimiter of a body MAY be missing the leading
 * CRLF when it sits at the very beginning of the body. Even though it is incorrect for a client to send a body in this
 * manner, RFC 2046 states that readers should be tolerant, and most writers do exactly that.
 *
 * After the marker a delimiter is either terminal ("--") or is followed by optional transport padding and a CRLF.
 * A marker followed by anything else is not a delimiter. It is body data that happens to contain the boundary.
 *
 * @author Karim Vidhani
 */
final class BoundaryScanner
{
  private final byte[] _openingDelimiterBytes;
  private final byte[] _delimiterBytes;

  BoundaryScanner(final byte[] boundary)
  {
    _openingDelimiterBytes = ArrayUtils.addAll(MultiPartFormDataUtils.DOUBLE_HYPHEN_BYTES, boundary);
    _delimiterBytes = ArrayUtils.addAll(MultiPartFormDataUtils.CRLF_BYTES, _openingDelimiterBytes);
  }

  int getDelimiterLength()
  {
    return _delimiterBytes.length;
  }

  /**
   * Searches the buffer for the first delimiter starting at {@code fromIndex}.
   *
   * @param buffer the bytes to search.
   * @param fromIndex first index a delimiter may start at.
   * @param openingAllowed true if the buffer still begins at the start of the body, so a delimiter without the
   *                       leading CRLF may be recognized at index 0.
   * @return the outcome of the search.
   */
  ScanResult find(final ByteStringBuffer buffer, final int fromIndex, final boolean openingAllowed)
  {
    if (openingAllowed && fromIndex == 0)
    {
      if (buffer.startsWith(_openingDelimiterBytes))
      {
        final ScanResult opening = classify(buffer, 0, _openingDelimiterBytes.length);
        if (opening != null)
        {
          return opening;
        }
      }
      else if (buffer.isPrefixOf(_openingDelimiterBytes))
      {
        //Everything we have could still become the opening delimiter.
        return ScanResult.notFound(buffer.size());
      }
    }

    int markerIndex = buffer.indexOfBytes(_delimiterBytes, fromIndex);
    while (markerIndex != -1)
    {
      final ScanResult result = classify(buffer, markerIndex, markerIndex + _delimiterBytes.length);
      if (result != null)
      {
        return result;
      }
      markerIndex = buffer.indexOfBytes(_delimiterBytes, markerIndex + 1);
    }

    return ScanResult.notFound(buffer.longestSuffixPrefixOf(_delimiterBytes));
  }

  //Returns null when the marker at markerStart turns out not to be a delimiter.
  private static ScanResult classify(final ByteStringBuffer buffer, final int markerStart, final int markerEnd)
  {
    final int size = buffer.size();
    if (markerEnd >= size)
    {
      return ScanResult.incomplete(markerStart);
    }

    final byte first = buffer.byteAtIndex(markerEnd);
    if (first == MultiPartFormDataUtils.HYPHEN_BYTE)
    {
      if (markerEnd + 1 >= size)
      {
        return ScanResult.incomplete(markerStart);
      }
      if (buffer.byteAtIndex(markerEnd + 1) == MultiPartFormDataUtils.HYPHEN_BYTE)
      {
        return ScanResult.found(markerStart, markerEnd + 2, true);
      }
      return null;
    }

    int index = markerEnd;
    while (index < size && MultiPartFormDataUtils.isTransportPadding(buffer.byteAtIndex(index)))
    {
      index++;
      if (index - markerEnd > MultiPartFormDataUtils.MAXIMUM_TRANSPORT_PADDING)
      {
        return null;
      }
    }

    if (index >= size)
    {
      return ScanResult.incomplete(markerStart);
    }
    if (buffer.byteAtIndex(index) != MultiPartFormDataUtils.CR_BYTE)
    {
      return null;
    }
    if (index + 1 >= size)
    {
      return ScanResult.incomplete(markerStart);
    }
    if (buffer.byteAtIndex(index + 1) != MultiPartFormDataUtils.LF_BYTE)
    {
      return null;
    }
    return ScanResult.found(markerStart, index + 2, false);
  }

  /**
   * Outcome of a single {@link #find(ByteStringBuffer, int, boolean)} call.
   */
  static final class ScanResult
  {
    enum Kind
    {
      //A complete delimiter line was located.
      FOUND,
      //No delimiter, but the trailing bytes may begin one.
      NOT_FOUND,
      //A marker was located, more bytes are needed to tell whether it is a delimiter.
      INCOMPLETE
    }

    private final Kind _kind;
    private final int _start;
    private final int _end;
    private final boolean _final;
    private final int _retain;

    private ScanResult(final Kind kind, final int start, final int end, final boolean isFinal, final int retain)
    {
      _kind = kind;
      _start = start;
      _end = end;
      _final = isFinal;
      _retain = retain;
    }

    static ScanResult found(final int start, final int end, final boolean isFinal)
    {
      return new ScanResult(Kind.FOUND, start, end, isFinal, 0);
    }

    static ScanResult notFound(final int retain)
    {
      return new ScanResult(Kind.NOT_FOUND, -1, -1, false, retain);
    }

    static ScanResult incomplete(final int start)
    {
      return new ScanResult(Kind.INCOMPLETE, start, -1, false, 0);
    }

    Kind getKind()
    {
      return _kind;
    }

    /**
     * First byte of the delimiter. Valid for FOUND and INCOMPLETE.
     */
    int getStart()
    {
      return _start;
    }

    /**
     * Index just past the delimiter line. Valid for FOUND.
     */
    int getEnd()
    {
      return _end;
    }

    boolean isFinal()
    {
      return _final;
    }

    /**
     * Number of trailing bytes that must be kept. Valid for NOT_FOUND.
     */
    int getRetain()
    {
      return _retain;
    }

    @Override
    public String toString()
    {
      switch (_kind)
      {
        case FOUND:
          return "FOUND(" + _start + ", " + _end + ", " + _final + ")";
        case INCOMPLETE:
          return "INCOMPLETE(" + _start + ")";
        default:
          return "NOT_FOUND(" + _retain + ")";
      }
    }
  }
}
