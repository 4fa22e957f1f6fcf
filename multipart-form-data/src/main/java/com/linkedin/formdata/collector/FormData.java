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


import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * The fields and files of a decoded form, in the order they appeared in the body. A name may occur more than once.
 */
public final class FormData
{
  private final List<FormDataField> _fields;
  private final List<FormDataFile> _files;

  public FormData(final List<FormDataField> fields, final List<FormDataFile> files)
  {
    _fields = Collections.unmodifiableList(new ArrayList<FormDataField>(fields));
    _files = Collections.unmodifiableList(new ArrayList<FormDataFile>(files));
  }

  public List<FormDataField> getFields()
  {
    return _fields;
  }

  /**
   * All values of the text fields, grouped by name in order of first appearance.
   */
  public Map<String, List<String>> getFieldValues()
  {
    final Map<String, List<String>> values = new LinkedHashMap<String, List<String>>();
    for (final FormDataField field : _fields)
    {
      List<String> list = values.get(field.getName());
      if (list == null)
      {
        list = new ArrayList<String>();
        values.put(field.getName(), list);
      }
      list.add(field.getValue());
    }
    return values;
  }

  public List<String> getFieldValues(final String name)
  {
    final List<String> values = new ArrayList<String>();
    for (final FormDataField field : _fields)
    {
      if (field.getName().equals(name))
      {
        values.add(field.getValue());
      }
    }
    return values;
  }

  /**
   * The first value of the named text field, or null.
   */
  public String getFieldValue(final String name)
  {
    for (final FormDataField field : _fields)
    {
      if (field.getName().equals(name))
      {
        return field.getValue();
      }
    }
    return null;
  }

  public List<FormDataFile> getFiles()
  {
    return _files;
  }

  public List<FormDataFile> getFiles(final String name)
  {
    final List<FormDataFile> files = new ArrayList<FormDataFile>();
    for (final FormDataFile file : _files)
    {
      if (file.getName().equals(name))
      {
        files.add(file);
      }
    }
    return files;
  }

  /**
   * The first file uploaded under the name, or null.
   */
  public FormDataFile getFile(final String name)
  {
    for (final FormDataFile file : _files)
    {
      if (file.getName().equals(name))
      {
        return file;
      }
    }
    return null;
  }

  public int getFileCount()
  {
    return _files.size();
  }

  @Override
  public String toString()
  {
    return "FormData{fields=" + _fields + ", files=" + _files + "}";
  }
}
