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
import com.linkedin.formdata.MultiPartFormDataUtils;
import com.linkedin.formdata.PartHeaders;


/**
 * A decoded file upload, held in memory.
 */
public final class FormDataFile
{
  private final String _name;
  private final String _filename;
  private final PartHeaders _headers;
  private final ByteString _content;

  public FormDataFile(final String name, final String filename, final PartHeaders headers, final ByteString content)
  {
    _name = name;
    _filename = filename;
    _headers = headers;
    _content = content;
  }

  /**
   * The form field name the file was uploaded under.
   */
  public String getName()
  {
    return _name;
  }

  /**
   * The filename sent by the client. May be empty if the user did not pick a file.
   */
  public String getFilename()
  {
    return _filename;
  }

  /**
   * The Content-Type header of the part, or null if the client did not send one.
   */
  public String getContentType()
  {
    return _headers.get(MultiPartFormDataUtils.CONTENT_TYPE_HEADER);
  }

  public PartHeaders getHeaders()
  {
    return _headers;
  }

  public ByteString getContent()
  {
    return _content;
  }

  public long getSize()
  {
    return _content.length();
  }

  @Override
  public String toString()
  {
    return "FormDataFile{name=" + _name + ", filename=" + _filename + ", size=" + _content.length() + "}";
  }
}
