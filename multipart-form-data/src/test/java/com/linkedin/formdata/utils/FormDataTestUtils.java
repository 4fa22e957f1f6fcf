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

package com.linkedin.formdata.utils;


import com.linkedin.data.ByteString;
import com.linkedin.formdata.DecodeEvent;
import com.linkedin.formdata.MultiPartFormDataDecoder;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang.ArrayUtils;


/**
 * Shared bodies and helpers for multipart/form-data tests.
 *
 * @author Karim Vidhani
 */
public final class FormDataTestUtils
{
  public static final Charset UTF_8 = Charset.forName("UTF-8");

  public static final String BOUNDARY = "AaB03x";

  //Two fields, one of them a file, as in the example of RFC 7578.
  public static final String SIMPLE_BODY =
      "--AaB03x\r\n"
      + "Content-Disposition: form-data; name=\"submit-name\"\r\n"
      + "\r\n"
      + "Larry\r\n"
      + "--AaB03x\r\n"
      + "Content-Disposition: form-data; name=\"files\"; filename=\"file1.txt\"\r\n"
      + "Content-Type: text/plain\r\n"
      + "\r\n"
      + "... contents of file1.txt ...\r\n"
      + "--AaB03x--\r\n";

  //Body data that contains almost-boundaries, CRLFs and hyphens.
  public static final String TRICKY_BODY =
      "preamble to be ignored\r\n"
      + "--AaB03x\r\n"
      + "Content-Disposition: form-data; name=\"tricky\"\r\n"
      + "\r\n"
      + "line one\r\n--AaB03\r\n\r\n--AaB03xy not a boundary\r\n-\r\n--\r\n"
      + "--AaB03x  \t\r\n"
      + "content-disposition: form-data; name=\"empty\"\r\n"
      + "\r\n"
      + "\r\n"
      + "--AaB03x\r\n"
      + "Content-Disposition: form-data; name=\"last\"\r\n"
      + "X-Custom: a\r\n"
      + "\r\n"
      + "\r\n\r\n"
      + "--AaB03x--\r\n";

  private FormDataTestUtils()
  {
  }

  public static byte[] bytes(final String string)
  {
    return string.getBytes(UTF_8);
  }

  /**
   * Splits the bytes into chunks of at most chunkSize bytes.
   */
  public static List<ByteString> split(final byte[] bytes, final int chunkSize)
  {
    final List<ByteString> chunks = new ArrayList<ByteString>();
    for (int i = 0; i < bytes.length; i += chunkSize)
    {
      chunks.add(ByteString.copy(ArrayUtils.subarray(bytes, i, Math.min(bytes.length, i + chunkSize))));
    }
    return chunks;
  }

  /**
   * Decodes the whole body, feeding it in chunks of the given size, and returns the normalized events.
   */
  public static List<DecodeEvent> decode(final String boundary, final byte[] body, final int chunkSize)
  {
    final MultiPartFormDataDecoder decoder = new MultiPartFormDataDecoder(boundary);
    final List<DecodeEvent> events = new ArrayList<DecodeEvent>();
    for (final ByteString chunk : split(body, chunkSize))
    {
      events.addAll(decoder.feed(chunk));
    }
    decoder.finish();
    return normalize(events);
  }

  /**
   * Merges consecutive body chunks so that events from differently chunked inputs can be compared. How a part's
   * body is split into chunks follows the input chunking, so two decodings are equal when their part starts and ends
   * match and the merged body chunks between them are equal.
   */
  public static List<DecodeEvent> normalize(final List<DecodeEvent> events)
  {
    final List<DecodeEvent> normalized = new ArrayList<DecodeEvent>();
    final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    for (final DecodeEvent event : events)
    {
      if (event.getType() == DecodeEvent.Type.BODY_CHUNK)
      {
        final byte[] data = ((DecodeEvent.BodyChunk) event).getData().copyBytes();
        pending.write(data, 0, data.length);
        continue;
      }
      if (pending.size() > 0)
      {
        normalized.add(new DecodeEvent.BodyChunk(ByteString.copy(pending.toByteArray())));
        pending.reset();
      }
      normalized.add(event);
    }
    if (pending.size() > 0)
    {
      normalized.add(new DecodeEvent.BodyChunk(ByteString.copy(pending.toByteArray())));
    }
    return normalized;
  }

  /**
   * Groups events into parts. Fails if the events are not well ordered.
   */
  public static List<DecodedPart> toParts(final List<DecodeEvent> events)
  {
    final List<DecodedPart> parts = new ArrayList<DecodedPart>();
    DecodedPart current = null;
    for (final DecodeEvent event : events)
    {
      switch (event.getType())
      {
        case PART_STARTED:
          if (current != null)
          {
            throw new AssertionError("Part started before the previous part ended");
          }
          current = new DecodedPart((DecodeEvent.PartStarted) event);
          break;
        case BODY_CHUNK:
          if (current == null)
          {
            throw new AssertionError("Body chunk outside of a part");
          }
          final byte[] data = ((DecodeEvent.BodyChunk) event).getData().copyBytes();
          if (data.length == 0)
          {
            throw new AssertionError("Empty body chunk");
          }
          current._body.write(data, 0, data.length);
          break;
        default:
          if (current == null)
          {
            throw new AssertionError("Part ended without being started");
          }
          parts.add(current);
          current = null;
      }
    }
    if (current != null)
    {
      throw new AssertionError("Part never ended");
    }
    return parts;
  }

  /**
   * Pulls every chunk out of the iterator and concatenates them.
   */
  public static byte[] drain(final Iterator<ByteString> chunks)
  {
    final ByteArrayOutputStream byteArrayOutputStream = new ByteArrayOutputStream();
    while (chunks.hasNext())
    {
      final byte[] data = chunks.next().copyBytes();
      if (data.length == 0)
      {
        throw new AssertionError("Empty chunk produced");
      }
      byteArrayOutputStream.write(data, 0, data.length);
    }
    return byteArrayOutputStream.toByteArray();
  }

  /**
   * A part as seen through the events of the decoder.
   */
  public static final class DecodedPart
  {
    private final DecodeEvent.PartStarted _partStarted;
    private final ByteArrayOutputStream _body = new ByteArrayOutputStream();

    private DecodedPart(final DecodeEvent.PartStarted partStarted)
    {
      _partStarted = partStarted;
    }

    public DecodeEvent.PartStarted getPartStarted()
    {
      return _partStarted;
    }

    public String getName()
    {
      return _partStarted.getName();
    }

    public String getFilename()
    {
      return _partStarted.getFilename();
    }

    public byte[] getBody()
    {
      return _body.toByteArray();
    }

    public String getBodyAsString()
    {
      return new String(getBody(), UTF_8);
    }
  }
}
