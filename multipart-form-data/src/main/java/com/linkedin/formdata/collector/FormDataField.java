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


import com.linkedin.formdata.PartHeaders;


/**
 * A decoded text field.
 */
public final class FormDataField
{
  private final String _name;
  private final String _value;
  private final PartHeaders _headers;

  public FormDataField(final String name, final String value, final PartHeaders headers)
  {
    _name = name;
    _value = value;
    _headers = headers;
  }

  public String getName()
  {
    return _name;
  }

  public String getValue()
  {
    return _value;
  }

  public PartHeaders getHeaders()
  {
    return _headers;
  }

  @Override
  public String toString()
  {
    return _name + "=" + _value;
  }
}
