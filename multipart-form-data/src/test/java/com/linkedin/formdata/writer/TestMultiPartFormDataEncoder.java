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


import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import com.linkedin.data.ByteString;
import com.linkedin.formdata.MultiPartFormDataUtils;
import com.linkedin.formdata.exceptions.FormDataEncodingException;
import com.linkedin.formdata.utils.FormDataTestUtils.DecodedPart;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import org.testng.Assert;
import org.testng.annotations.Test;

import static com.linkedin.formdata.utils.FormDataTestUtils.UTF_8;
import static com.linkedin.formdata.utils.FormDataTestUtils.bytes;
import static com.linkedin.formdata.utils.FormDataTestUtils.decode;
import static com.linkedin.formdata.utils.FormDataTestUtils.drain;
import static com.linkedin.formdata.utils.FormDataTestUtils.toParts;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;


/**
 * @author Karim Vidhani
 */
public class TestMultiPartFormDataEncoder
{
  @Test
  public void testExactBytes() throws Exception
  {
    final MultiPartFormDataEncoder encoder = new MultiPartFormDataEncoder.Builder("b")
        .appendPart(FormDataPart.field("name", "value"))
        .appendPart(FormDataPart.file("f", "a.txt", "text/plain", ByteString.copyString("data", UTF_8)))
        .build();

    final List<String> chunks = new ArrayList<String>();
    while (encoder.hasNext())
    {
      chunks.add(new String(encoder.next().copyBytes(), UTF_8));
    }

    Assert.assertEquals(chunks, ImmutableList.of(
        "\r\n--b\r\nContent-Disposition: form-data; name=\"name\"\r\n\r\n",
        "value",
        "\r\n--b\r\nContent-Disposition: form-data; name=\"f\"; filename=\"a.txt\"\r\nContent-Type: text/plain\r\n\r\n",
        "data",
        "\r\n--b--\r\n"));
  }

  @Test
  public void testNoParts() throws Exception
  {
    final MultiPartFormDataEncoder encoder =
        MultiPartFormDataEncoder.encode("b", Collections.<FormDataPart>emptyList());
    Assert.assertEquals(encoder.getContentLength(), 9);
    Assert.assertEquals(drain(encoder), bytes("\r\n--b--\r\n"));
    Assert.assertTrue(decode("b", bytes("\r\n--b--\r\n"), 1).isEmpty());
  }

  @Test
  public void testPreambleAndEpilogue() throws Exception
  {
    final MultiPartFormDataEncoder encoder = new MultiPartFormDataEncoder.Builder("b")
        .withPreamble("This is the preamble.")
        .withEpilogue("This is the epilogue.")
        .appendPart(FormDataPart.field("a", "1"))
        .build();
    final byte[] body = drain(encoder);

    Assert.assertEquals(new String(body, UTF_8), "This is the preamble."
        + "\r\n--b\r\nContent-Disposition: form-data; name=\"a\"\r\n\r\n1"
        + "\r\n--b--\r\nThis is the epilogue.");

    //The epilogue must arrive in the same chunk as the terminal boundary.
    final List<DecodedPart> parts = toParts(decode("b", body, body.length));
    Assert.assertEquals(parts.size(), 1);
    Assert.assertEquals(parts.get(0).getBodyAsString(), "1");
  }

  @Test
  public void testEscapedNames() throws Exception
  {
    final MultiPartFormDataEncoder encoder = new MultiPartFormDataEncoder.Builder("b")
        .appendPart(new FormDataPart.Builder("say \"hi\"").withFilename("C:\\dir\\a.txt").build())
        .build();

    Assert.assertEquals(new String(encoder.next().copyBytes(), UTF_8),
        "\r\n--b\r\nContent-Disposition: form-data; name=\"say \\\"hi\\\"\"; filename=\"C:\\\\dir\\\\a.txt\"\r\n\r\n");
  }

  @Test
  public void testExtraHeaders() throws Exception
  {
    final FormDataPart part = new FormDataPart.Builder("a")
        .withContentType("text/plain; charset=UTF-8")
        .withHeader("Content-Disposition", "attachment")
        .withHeader("content-type", "application/json")
        .withHeader("X-First", "1")
        .withHeader("X-Second", "2")
        .withBody("x", UTF_8)
        .build();

    final MultiPartFormDataEncoder encoder = new MultiPartFormDataEncoder.Builder("b").appendPart(part).build();
    Assert.assertEquals(new String(encoder.next().copyBytes(), UTF_8),
        "\r\n--b\r\nContent-Disposition: form-data; name=\"a\"\r\nContent-Type: text/plain; charset=UTF-8\r\n"
            + "X-First: 1\r\nX-Second: 2\r\n\r\n");
  }

  @Test
  public void testEmptyChunksAreSkipped() throws Exception
  {
    final List<ByteString> chunks = ImmutableList.of(ByteString.empty(), ByteString.copyString("a", UTF_8),
        ByteString.empty(), ByteString.copyString("b", UTF_8), ByteString.empty());
    final MultiPartFormDataEncoder encoder = new MultiPartFormDataEncoder.Builder("b")
        .appendPart(new FormDataPart.Builder("it").withBody(new IteratorBodySource(chunks.iterator())).build())
        .appendPart(new FormDataPart.Builder("empty").build())
        .build();

    //drain() fails on empty chunks.
    final List<DecodedPart> parts = toParts(decode("b", drain(encoder), 4));
    Assert.assertEquals(parts.get(0).getBodyAsString(), "ab");
    Assert.assertEquals(parts.get(1).getBody().length, 0);
  }

  @Test
  public void testExhaustion() throws Exception
  {
    final MultiPartFormDataEncoder encoder =
        MultiPartFormDataEncoder.encode("b", ImmutableList.of(FormDataPart.field("a", "1")));
    drain(encoder);
    Assert.assertFalse(encoder.hasNext());
    try
    {
      encoder.next();
      Assert.fail();
    }
    catch (NoSuchElementException noSuchElementException)
    {
      //pass
    }
  }

  @Test(expectedExceptions = UnsupportedOperationException.class)
  public void testRemove() throws Exception
  {
    MultiPartFormDataEncoder.encode("b", Collections.<FormDataPart>emptyList()).remove();
  }

  @Test
  public void testContentLength() throws Exception
  {
    final MultiPartFormDataEncoder known = new MultiPartFormDataEncoder.Builder("boundary")
        .withPreamble("pre")
        .appendPart(FormDataPart.field("a", "ünïcödé"))
        .appendPart(new FormDataPart.Builder("s")
            .withBody(new InputStreamBodySource.Builder(new ByteArrayInputStream(bytes("12345"))).withLength(5).build())
            .build())
        .withEpilogue("post")
        .build();
    final long expected = known.getContentLength();
    Assert.assertEquals(drain(known).length, expected);

    final MultiPartFormDataEncoder unknown = new MultiPartFormDataEncoder.Builder("boundary")
        .appendPart(FormDataPart.field("a", "1"))
        .appendPart(new FormDataPart.Builder("s")
            .withBody(new InputStreamBodySource.Builder(new ByteArrayInputStream(bytes("12345"))).build())
            .build())
        .build();
    Assert.assertEquals(unknown.getContentLength(), -1);
  }

  @Test
  public void testRoundTrip() throws Exception
  {
    final byte[] binary = new byte[10000];
    for (int i = 0; i < binary.length; i++)
    {
      binary[i] = (byte) (i % 7 == 0 ? '\r' : i % 7 == 1 ? '\n' : '-');
    }

    final MultiPartFormDataEncoder encoder = new MultiPartFormDataEncoder.Builder()
        .appendPart(FormDataPart.field("greeting", "héllo"))
        .appendPart(new FormDataPart.Builder("résumé").withFilename("naïve.bin")
            .withContentType("application/octet-stream")
            .withBody(new InputStreamBodySource.Builder(new ByteArrayInputStream(binary)).withWriteChunkSize(333).build())
            .build())
        .build();
    Assert.assertEquals(MultiPartFormDataUtils.extractBoundary(encoder.getContentTypeHeader()), encoder.getBoundary());

    final List<DecodedPart> parts = toParts(decode(encoder.getBoundary(), drain(encoder), 97));
    Assert.assertEquals(parts.size(), 2);
    Assert.assertEquals(parts.get(0).getName(), "greeting");
    Assert.assertEquals(parts.get(0).getBodyAsString(), "héllo");
    Assert.assertEquals(parts.get(1).getName(), "résumé");
    Assert.assertEquals(parts.get(1).getFilename(), "naïve.bin");
    Assert.assertEquals(parts.get(1).getPartStarted().getContentType(), "application/octet-stream");
    Assert.assertEquals(parts.get(1).getBody(), binary);
  }

  @Test
  public void testBodySourceFailure() throws Exception
  {
    final IOException ioException = new IOException("Disk went away");
    final FormDataBodySource failing = mock(FormDataBodySource.class);
    when(failing.length()).thenReturn(-1L);
    when(failing.nextChunk()).thenReturn(ByteString.copyString("partial", UTF_8)).thenThrow(ioException);
    final FormDataBodySource untouched = mock(FormDataBodySource.class);

    final MultiPartFormDataEncoder encoder = new MultiPartFormDataEncoder.Builder("b")
        .appendPart(new FormDataPart.Builder("failing").withBody(failing).build())
        .appendPart(new FormDataPart.Builder("untouched").withBody(untouched).build())
        .build();

    encoder.next();
    Assert.assertEquals(encoder.next(), ByteString.copyString("partial", UTF_8));
    try
    {
      encoder.next();
      Assert.fail();
    }
    catch (FormDataEncodingException encodingException)
    {
      Assert.assertSame(encodingException.getCause(), ioException);
    }

    Assert.assertFalse(encoder.hasNext());
    verify(failing, times(1)).close();
    verify(untouched, times(1)).close();
    verify(untouched, times(0)).nextChunk();
  }

  @Test
  public void testClose() throws Exception
  {
    final FormDataBodySource first = mock(FormDataBodySource.class);
    final FormDataBodySource second = mock(FormDataBodySource.class);
    final MultiPartFormDataEncoder encoder = new MultiPartFormDataEncoder.Builder("b")
        .appendPart(new FormDataPart.Builder("first").withBody(first).build())
        .appendPart(new FormDataPart.Builder("second").withBody(second).build())
        .build();

    //Boundary and headers of the first part.
    encoder.next();
    encoder.close();
    encoder.close();

    Assert.assertFalse(encoder.hasNext());
    verify(first, times(1)).close();
    verify(second, times(1)).close();
  }

  @Test
  public void testAsInputStream() throws Exception
  {
    final List<FormDataPart> parts = ImmutableList.of(FormDataPart.field("a", "1"), FormDataPart.field("b", "2"));
    final byte[] expected = drain(MultiPartFormDataEncoder.encode("b", parts));

    final InputStream inputStream = MultiPartFormDataEncoder.encode("b",
        ImmutableList.of(FormDataPart.field("a", "1"), FormDataPart.field("b", "2"))).asInputStream();
    Assert.assertEquals(inputStream.read(), '\r');
    final byte[] rest = ByteStreams.toByteArray(inputStream);
    Assert.assertEquals(rest.length + 1, expected.length);
    Assert.assertEquals(rest[rest.length - 1], '\n');
    Assert.assertEquals(inputStream.read(), -1);
  }

  @Test
  public void testInputStreamSurfacesIOException() throws Exception
  {
    final IOException ioException = new IOException("Broken");
    final FormDataBodySource failing = mock(FormDataBodySource.class);
    when(failing.nextChunk()).thenThrow(ioException);

    final InputStream inputStream = new MultiPartFormDataEncoder.Builder("b")
        .appendPart(new FormDataPart.Builder("failing").withBody(failing).build())
        .build()
        .asInputStream();
    try
    {
      ByteStreams.toByteArray(inputStream);
      Assert.fail();
    }
    catch (IOException exception)
    {
      Assert.assertSame(exception, ioException);
    }
  }

  @Test
  public void testInvalidBoundaries()
  {
    for (final String boundary : new String[]{null, "", "a\r\nb", new String(new char[71]).replace('\0', 'a')})
    {
      try
      {
        new MultiPartFormDataEncoder.Builder(boundary);
        Assert.fail("Accepted '" + boundary + "'");
      }
      catch (IllegalArgumentException illegalArgumentException)
      {
        //pass
      }
    }
    Assert.assertEquals(new MultiPartFormDataEncoder.Builder("AaB03x").build().getContentTypeHeader(),
        "multipart/form-data; boundary=AaB03x");
  }
}
