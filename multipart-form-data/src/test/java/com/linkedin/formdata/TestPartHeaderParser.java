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


import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.linkedin.formdata.exceptions.MalformedHeaderException;
import com.linkedin.formdata.exceptions.MissingFieldNameException;

import java.nio.charset.Charset;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;


/**
 * @author Karim Vidhani
 */
public class TestPartHeaderParser
{
  private static final Charset UTF_8 = Charset.forName("UTF-8");

  private final PartHeaderParser _parser = new PartHeaderParser(UTF_8);

  @Test
  public void testEmptyBlock() throws Exception
  {
    final PartHeaders headers = _parser.parse(new byte[0]);
    Assert.assertTrue(headers.isEmpty());
    Assert.assertSame(headers, PartHeaders.empty());
  }

  @Test
  public void testOrderAndCaseInsensitiveLookup() throws Exception
  {
    final PartHeaders headers = _parser.parse(
        "Content-Disposition: form-data; name=\"a\"\r\nContent-Type: text/plain\r\nX-Custom:value:with:colons"
            .getBytes(UTF_8));

    Assert.assertEquals(headers.size(), 3);
    Assert.assertEquals(headers.names(), ImmutableList.of("content-disposition", "content-type", "x-custom"));
    Assert.assertEquals(headers.get("CONTENT-TYPE"), "text/plain");
    Assert.assertEquals(headers.get("x-custom"), "value:with:colons");
    Assert.assertEquals(headers.getOriginalName("x-custom"), "X-Custom");
    Assert.assertTrue(headers.contains("Content-Disposition"));
    Assert.assertFalse(headers.contains("Content-Length"));
    Assert.assertNull(headers.get("Content-Length"));
  }

  @Test
  public void testFoldedHeader() throws Exception
  {
    final PartHeaders headers = _parser.parse(
        "Content-Disposition: form-data;\r\n name=\"folded\";\r\n\t filename=\"f.txt\"\r\nX-A: b".getBytes(UTF_8));

    Assert.assertEquals(headers.get("content-disposition"), "form-data; name=\"folded\"; filename=\"f.txt\"");
    Assert.assertEquals(headers.get("x-a"), "b");
  }

  @Test
  public void testDuplicateHeaders() throws Exception
  {
    final PartHeaders headers = _parser.parse("X-Dup: first\r\nX-Other: o\r\nx-dup: second".getBytes(UTF_8));

    //First position and name, last value.
    Assert.assertEquals(headers.asOriginalMap(), ImmutableMap.of("X-Dup", "second", "X-Other", "o"));
    Assert.assertEquals(headers.asMap(), ImmutableMap.of("x-dup", "second", "x-other", "o"));
  }

  @Test
  public void testNonAsciiHeaderValue() throws Exception
  {
    final PartHeaders headers =
        _parser.parse("Content-Disposition: form-data; name=\"f\"; filename=\"résumé.pdf\"".getBytes(UTF_8));
    final ParameterizedHeader disposition = _parser.parseContentDisposition(headers);
    Assert.assertEquals(disposition.getParameter("filename"), "résumé.pdf");
  }

  @Test
  public void testLatin1Parser() throws Exception
  {
    final Charset latin1 = Charset.forName("ISO-8859-1");
    final PartHeaderParser parser = new PartHeaderParser(latin1);
    Assert.assertEquals(parser.getCharset(), latin1);

    final PartHeaders headers = parser.parse("X-Name: café".getBytes(latin1));
    Assert.assertEquals(headers.get("x-name"), "café");
  }

  @DataProvider(name = "malformedBlocks")
  public Object[][] malformedBlocks()
  {
    return new Object[][]{
        {"no colon here"},
        {"Content-Disposition: form-data; name=\"a\"\r\nbroken line"},
        {": empty name"},
        {" starts with a continuation"}
    };
  }

  @Test(dataProvider = "malformedBlocks", expectedExceptions = MalformedHeaderException.class)
  public void testMalformedBlock(final String block) throws Exception
  {
    _parser.parse(block.getBytes(UTF_8));
  }

  @Test
  public void testContentDisposition() throws Exception
  {
    final PartHeaders headers =
        _parser.parse("content-disposition: form-data; name=\"upload\"; filename=\"a.txt\"".getBytes(UTF_8));
    final ParameterizedHeader disposition = _parser.parseContentDisposition(headers);
    Assert.assertEquals(disposition.getToken(), "form-data");
    Assert.assertEquals(disposition.getParameter("name"), "upload");
    Assert.assertEquals(disposition.getParameter("filename"), "a.txt");
  }

  @Test
  public void testEmptyNameIsAllowed() throws Exception
  {
    final PartHeaders headers = _parser.parse("Content-Disposition: form-data; name=\"\"".getBytes(UTF_8));
    Assert.assertEquals(_parser.parseContentDisposition(headers).getParameter("name"), "");
  }

  @DataProvider(name = "missingNames")
  public Object[][] missingNames()
  {
    return new Object[][]{
        {"Content-Type: text/plain"},
        {"Content-Disposition: form-data"},
        {"Content-Disposition: form-data; filename=\"a.txt\""},
        {""}
    };
  }

  @Test(dataProvider = "missingNames", expectedExceptions = MissingFieldNameException.class)
  public void testMissingName(final String block) throws Exception
  {
    _parser.parseContentDisposition(_parser.parse(block.getBytes(UTF_8)));
  }
}
