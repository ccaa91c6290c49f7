package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import info.isaksson.erland.vbform.model.controls.*;

import java.util.List;
import java.util.Objects;

/**
 * The typed payload of a {@link ControlNode}: one variant per built-in VB6 control, plus
 * {@link Custom} for controls from any other library.
 *
 * <p>The set of variants is closed. Containers ({@link Form}, {@link MdiForm}, {@link Frame},
 * {@link PictureBox}) own their child controls; forms additionally own their top-level menus and
 * {@link Menu} owns its sub-menus. Every variant keeps the control's property groups (fonts and
 * similar compound properties).</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ControlKind.Form.class, name = "Form"),
        @JsonSubTypes.Type(value = ControlKind.MdiForm.class, name = "MDIForm"),
        @JsonSubTypes.Type(value = ControlKind.Frame.class, name = "Frame"),
        @JsonSubTypes.Type(value = ControlKind.CheckBox.class, name = "CheckBox"),
        @JsonSubTypes.Type(value = ControlKind.ComboBox.class, name = "ComboBox"),
        @JsonSubTypes.Type(value = ControlKind.CommandButton.class, name = "CommandButton"),
        @JsonSubTypes.Type(value = ControlKind.Data.class, name = "Data"),
        @JsonSubTypes.Type(value = ControlKind.DirListBox.class, name = "DirListBox"),
        @JsonSubTypes.Type(value = ControlKind.DriveListBox.class, name = "DriveListBox"),
        @JsonSubTypes.Type(value = ControlKind.FileListBox.class, name = "FileListBox"),
        @JsonSubTypes.Type(value = ControlKind.Image.class, name = "Image"),
        @JsonSubTypes.Type(value = ControlKind.Label.class, name = "Label"),
        @JsonSubTypes.Type(value = ControlKind.Line.class, name = "Line"),
        @JsonSubTypes.Type(value = ControlKind.ListBox.class, name = "ListBox"),
        @JsonSubTypes.Type(value = ControlKind.Menu.class, name = "Menu"),
        @JsonSubTypes.Type(value = ControlKind.Ole.class, name = "OLE"),
        @JsonSubTypes.Type(value = ControlKind.OptionButton.class, name = "OptionButton"),
        @JsonSubTypes.Type(value = ControlKind.PictureBox.class, name = "PictureBox"),
        @JsonSubTypes.Type(value = ControlKind.HScrollBar.class, name = "HScrollBar"),
        @JsonSubTypes.Type(value = ControlKind.VScrollBar.class, name = "VScrollBar"),
        @JsonSubTypes.Type(value = ControlKind.Shape.class, name = "Shape"),
        @JsonSubTypes.Type(value = ControlKind.TextBox.class, name = "TextBox"),
        @JsonSubTypes.Type(value = ControlKind.Timer.class, name = "Timer"),
        @JsonSubTypes.Type(value = ControlKind.Custom.class, name = "Custom")
})
public abstract class ControlKind {

    /** Variant tag; {@link #vbName()} is the kind token used after {@code VB.} in form files. */
    public enum Type {
        FORM("Form", true),
        MDI_FORM("MDIForm", true),
        FRAME("Frame", true),
        CHECK_BOX("CheckBox", false),
        COMBO_BOX("ComboBox", false),
        COMMAND_BUTTON("CommandButton", false),
        DATA("Data", false),
        DIR_LIST_BOX("DirListBox", false),
        DRIVE_LIST_BOX("DriveListBox", false),
        FILE_LIST_BOX("FileListBox", false),
        IMAGE("Image", false),
        LABEL("Label", false),
        LINE("Line", false),
        LIST_BOX("ListBox", false),
        MENU("Menu", false),
        OLE("OLE", false),
        OPTION_BUTTON("OptionButton", false),
        PICTURE_BOX("PictureBox", true),
        H_SCROLL_BAR("HScrollBar", false),
        V_SCROLL_BAR("VScrollBar", false),
        SHAPE("Shape", false),
        TEXT_BOX("TextBox", false),
        TIMER("Timer", false),
        CUSTOM(null, true);

        private final String vbName;
        private final boolean container;

        Type(String vbName, boolean container) {
            this.vbName = vbName;
            this.container = container;
        }

        public String vbName() {
            return vbName;
        }

        /** Whether controls other than menus may be nested inside this kind. */
        public boolean isContainer() {
            return container;
        }

        /** Built-in kind for a {@code VB.<kind>} token, or {@code null} if there is none. */
        public static Type fromVbName(String kind) {
            for (Type t : values()) {
                if (t.vbName != null && t.vbName.equals(kind)) return t;
            }
            return null;
        }
    }

    public final List<PropertyGroup> propertyGroups;

    private ControlKind(List<PropertyGroup> propertyGroups) {
        this.propertyGroups = propertyGroups == null ? List.of() : List.copyOf(propertyGroups);
    }

    public abstract Type type();

    /** The typed properties of the variant; the raw {@link Properties} for {@link Custom}. */
    protected abstract Object payload();

    /** Child controls (not menus); empty for kinds that cannot contain any. */
    public List<ControlNode> children() {
        return List.of();
    }

    /** Menus owned by this node: top-level menus of a form, sub-menus of a menu. */
    public List<ControlNode> menus() {
        return List.of();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ControlKind that = (ControlKind) o;
        return payload().equals(that.payload()) && propertyGroups.equals(that.propertyGroups)
                && children().equals(that.children()) && menus().equals(that.menus());
    }

    @Override public int hashCode() {
        return Objects.hash(getClass(), payload(), propertyGroups, children(), menus());
    }

    private static List<ControlNode> copy(List<ControlNode> nodes) {
        return nodes == null ? List.of() : List.copyOf(nodes);
    }

    private static <P> P require(P properties) {
        if (properties == null) throw new IllegalArgumentException("properties must not be null");
        return properties;
    }

    public static final class Form extends ControlKind {
        public final FormProperties properties;
        public final List<ControlNode> controls;
        public final List<ControlNode> menus;

        public Form(FormProperties properties, List<ControlNode> controls, List<ControlNode> menus, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
            this.controls = copy(controls);
            this.menus = copy(menus);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.FORM;
        }

        @Override public List<ControlNode> children() {
            return controls;
        }

        @Override public List<ControlNode> menus() {
            return menus;
        }
    }

    public static final class MdiForm extends ControlKind {
        public final MdiFormProperties properties;
        public final List<ControlNode> controls;
        public final List<ControlNode> menus;

        public MdiForm(MdiFormProperties properties, List<ControlNode> controls, List<ControlNode> menus, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
            this.controls = copy(controls);
            this.menus = copy(menus);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.MDI_FORM;
        }

        @Override public List<ControlNode> children() {
            return controls;
        }

        @Override public List<ControlNode> menus() {
            return menus;
        }
    }

    public static final class Frame extends ControlKind {
        public final FrameProperties properties;
        public final List<ControlNode> controls;

        public Frame(FrameProperties properties, List<ControlNode> controls, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
            this.controls = copy(controls);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.FRAME;
        }

        @Override public List<ControlNode> children() {
            return controls;
        }
    }

    public static final class CheckBox extends ControlKind {
        public final CheckBoxProperties properties;

        public CheckBox(CheckBoxProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.CHECK_BOX;
        }
    }

    public static final class ComboBox extends ControlKind {
        public final ComboBoxProperties properties;

        public ComboBox(ComboBoxProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.COMBO_BOX;
        }
    }

    public static final class CommandButton extends ControlKind {
        public final CommandButtonProperties properties;

        public CommandButton(CommandButtonProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.COMMAND_BUTTON;
        }
    }

    public static final class Data extends ControlKind {
        public final DataProperties properties;

        public Data(DataProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.DATA;
        }
    }

    public static final class DirListBox extends ControlKind {
        public final DirListBoxProperties properties;

        public DirListBox(DirListBoxProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.DIR_LIST_BOX;
        }
    }

    public static final class DriveListBox extends ControlKind {
        public final DriveListBoxProperties properties;

        public DriveListBox(DriveListBoxProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.DRIVE_LIST_BOX;
        }
    }

    public static final class FileListBox extends ControlKind {
        public final FileListBoxProperties properties;

        public FileListBox(FileListBoxProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.FILE_LIST_BOX;
        }
    }

    public static final class Image extends ControlKind {
        public final ImageProperties properties;

        public Image(ImageProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.IMAGE;
        }
    }

    public static final class Label extends ControlKind {
        public final LabelProperties properties;

        public Label(LabelProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.LABEL;
        }
    }

    public static final class Line extends ControlKind {
        public final LineProperties properties;

        public Line(LineProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.LINE;
        }
    }

    public static final class ListBox extends ControlKind {
        public final ListBoxProperties properties;

        public ListBox(ListBoxProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.LIST_BOX;
        }
    }

    public static final class Menu extends ControlKind {
        public final MenuProperties properties;
        public final List<ControlNode> subMenus;

        public Menu(MenuProperties properties, List<ControlNode> subMenus, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
            this.subMenus = copy(subMenus);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.MENU;
        }

        @Override public List<ControlNode> menus() {
            return subMenus;
        }
    }

    public static final class Ole extends ControlKind {
        public final OleProperties properties;

        public Ole(OleProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.OLE;
        }
    }

    public static final class OptionButton extends ControlKind {
        public final OptionButtonProperties properties;

        public OptionButton(OptionButtonProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.OPTION_BUTTON;
        }
    }

    public static final class PictureBox extends ControlKind {
        public final PictureBoxProperties properties;
        public final List<ControlNode> controls;

        public PictureBox(PictureBoxProperties properties, List<ControlNode> controls, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
            this.controls = copy(controls);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.PICTURE_BOX;
        }

        @Override public List<ControlNode> children() {
            return controls;
        }
    }

    public static final class HScrollBar extends ControlKind {
        public final ScrollBarProperties properties;

        public HScrollBar(ScrollBarProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.H_SCROLL_BAR;
        }
    }

    public static final class VScrollBar extends ControlKind {
        public final ScrollBarProperties properties;

        public VScrollBar(ScrollBarProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.V_SCROLL_BAR;
        }
    }

    public static final class Shape extends ControlKind {
        public final ShapeProperties properties;

        public Shape(ShapeProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.SHAPE;
        }
    }

    public static final class TextBox extends ControlKind {
        public final TextBoxProperties properties;

        public TextBox(TextBoxProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.TEXT_BOX;
        }
    }

    public static final class Timer extends ControlKind {
        public final TimerProperties properties;

        public Timer(TimerProperties properties, List<PropertyGroup> propertyGroups) {
            super(propertyGroups);
            this.properties = require(properties);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.TIMER;
        }
    }

    /**
     * A control outside the {@code VB} namespace. Raw properties are kept as read, along with any
     * nested controls.
     */
    public static final class Custom extends ControlKind {
        public final String namespace;
        public final String kind;
        public final Properties properties;
        public final List<ControlNode> controls;

        public Custom(String namespace, String kind, Properties properties, List<PropertyGroup> propertyGroups, List<ControlNode> controls) {
            super(propertyGroups);
            this.namespace = namespace == null ? "" : namespace;
            this.kind = kind == null ? "" : kind;
            this.properties = properties == null ? Properties.empty() : properties;
            this.controls = copy(controls);
        }

        @Override protected Object payload() {
            return properties;
        }

        @Override public Type type() {
            return Type.CUSTOM;
        }

        @Override public List<ControlNode> children() {
            return controls;
        }

        @Override public boolean equals(Object o) {
            if (!super.equals(o)) return false;
            Custom that = (Custom) o;
            return namespace.equals(that.namespace) && kind.equals(that.kind);
        }

        @Override public int hashCode() {
            return 31 * super.hashCode() + Objects.hash(namespace, kind);
        }
    }
}
