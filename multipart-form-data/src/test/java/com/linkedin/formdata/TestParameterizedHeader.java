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


import com.google.common.collect.ImmutableMap;

import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;


public class TestParameterizedHeader
{
  @DataProvider(name = "headerValues")
  public Object[][] headerValues() throws Exception
  {
    //The raw header value, the expected token and the expected parameters.
    return new Object[][]{
        {"form-data; name=\"file\"; filename=\"a.txt\"", "form-data",
            ImmutableMap.of("name", "file", "filename", "a.txt")},
        {"form-data; name=field", "form-data", ImmutableMap.of("name", "field")},
        {"form-data;name=\"a;b=c\";  filename = \"x y.txt\" ", "form-data",
            ImmutableMap.of("name", "a;b=c", "filename", "x y.txt")},
        {"form-data; NAME=\"upper\"", "form-data", ImmutableMap.of("name", "upper")},
        {"form-data; name=\"say \\\"hi\\\"\"", "form-data", ImmutableMap.of("name", "say \"hi\"")},
        {"form-data; name=\"back\\\\slash\"", "form-data", ImmutableMap.of("name", "back\\slash")},
        {"form-data; name=\"\"", "form-data", ImmutableMap.of("name", "")},
        {"text/plain; charset=ISO-8859-1", "text/plain", ImmutableMap.of("charset", "ISO-8859-1")},
        {"form-data", "form-data", ImmutableMap.<String, String>of()},
        {"", "", ImmutableMap.<String, String>of()},
        //Parameters without a value are ignored.
        {"form-data; flag; name=\"x\"", "form-data", ImmutableMap.of("name", "x")},
        //An unterminated quoted string ends the parameter list.
        {"form-data; name=\"x\"; filename=\"broken", "form-data", ImmutableMap.of("name", "x")},
    };
  }

  @Test(dataProvider = "headerValues")
  public void testParse(final String headerValue, final String expectedToken,
      final Map<String, String> expectedParameters)
  {
    final ParameterizedHeader header = ParameterizedHeader.parse(headerValue);
    Assert.assertEquals(header.getToken(), expectedToken);
    Assert.assertEquals(header.getParameters(), expectedParameters);
  }

  @Test
  public void testUncPathFilenameIsKeptVerbatim()
  {
    final ParameterizedHeader header =
        ParameterizedHeader.parse("form-data; name=\"upload\"; filename=\"\\\\server\\share\\a.txt\"");
    //The quoted content starts with two backslashes, so nothing is unescaped.
    Assert.assertEquals(header.getParameter("filename"), "\\\\server\\share\\a.txt");
    Assert.assertEquals(header.getParameter("name"), "upload");
  }

  @Test
  public void testExtendedParameterTakesPrecedence()
  {
    final ParameterizedHeader header = ParameterizedHeader.parse(
        "form-data; name=\"upload\"; filename=\"naive.txt\"; filename*=UTF-8''na%C3%AFve%20file.txt");
    Assert.assertEquals(header.getParameter("filename"), "naïve file.txt");
    Assert.assertEquals(header.getParameters().keySet().iterator().next(), "name");
  }

  @Test
  public void testExtendedParameterWithLanguageAndLatin1()
  {
    final ParameterizedHeader header = ParameterizedHeader.parse("attachment; filename*=ISO-8859-1'en'%A3%20rates.txt");
    Assert.assertEquals(header.getParameter("filename"), "£ rates.txt");
  }

  @Test
  public void testMalformedExtendedParameterFallsBackToPlainValue()
  {
    final ParameterizedHeader unknownCharset =
        ParameterizedHeader.parse("form-data; filename=\"plain.txt\"; filename*=NOT-A-CHARSET''x.txt");
    Assert.assertEquals(unknownCharset.getParameter("filename"), "plain.txt");

    final ParameterizedHeader missingQuotes = ParameterizedHeader.parse("form-data; filename=\"plain.txt\"; filename*=x.txt");
    Assert.assertEquals(missingQuotes.getParameter("filename"), "plain.txt");
  }

  @Test
  public void testContinuations()
  {
    final ParameterizedHeader plain =
        ParameterizedHeader.parse("form-data; name*0=\"long \"; name*1=\"field\"; name*2=\" name\"");
    Assert.assertEquals(plain.getParameter("name"), "long field name");

    final ParameterizedHeader encoded =
        ParameterizedHeader.parse("form-data; name=\"x\"; filename*0*=UTF-8''caf%C3%A9; filename*1=\"-menu\"; filename*2*=%2Etxt");
    Assert.assertEquals(encoded.getParameter("filename"), "café-menu.txt");

    //A gap ends the value.
    final ParameterizedHeader gap = ParameterizedHeader.parse("form-data; name*0=a; name*2=c");
    Assert.assertEquals(gap.getParameter("name"), "a");
  }

  @Test
  public void testPercentDecodeKeepsInvalidEscapes()
  {
    Assert.assertEquals(new String(ParameterizedHeader.percentDecode("100%25 %zz %4"), MultiPartFormDataUtils.UTF_8),
        "100% %zz %4");
  }

  @Test
  public void testToStringQuotesWhenNeeded()
  {
    final ParameterizedHeader header = ParameterizedHeader.parse("form-data; name=\"a b\"; size=10");
    Assert.assertEquals(header.toString(), "form-data; name=\"a b\"; size=10");
  }
}
